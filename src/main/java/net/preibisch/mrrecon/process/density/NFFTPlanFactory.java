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

public interface NFFTPlanFactory
{
	/**
	 * @param nodes - [ numNodes ][ numDimensions ] in [-0.5, 0.5)
	 * @param shape - the image size
	 * @param kernelSupport - the window size of the interpolation kernel
	 * @param oversamplingFactor - the oversampling of the internal grid
	 * @return the plan
	 */
	public NFFTPlan create( final double[][] nodes, final int[] shape, final int kernelSupport, final double oversamplingFactor );
}
