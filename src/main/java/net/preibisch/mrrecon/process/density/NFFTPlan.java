/*-
 * #%L
 * Software for the reconstruction of magnetic resonance acquisitions
 * from Cartesian and non-Cartesian k-space data.
 * %%
 * Copyright (C) 2012 - 2025 MR Reconstruction developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.mrrecon.process.density;

/**
 * A plan of a non-uniform FFT for a fixed set of nodes and a fixed image shape.
 */
public interface NFFTPlan
{
	/**
	 * @return the number of nodes the plan was created for
	 */
	public int numNodes();

	/**
	 * Estimates the sampling density compensation for every node of the plan.
	 *
	 * @return one non-negative weight per node
	 */
	public double[] estimateDensity();
}
