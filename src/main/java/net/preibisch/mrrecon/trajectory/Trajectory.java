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
package net.preibisch.mrrecon.trajectory;

/**
 * The k-space nodes (and their readout times) visited during an acquisition.
 *
 * Geometries (Cartesian, EPI, radial, spiral, ...) are generated elsewhere and
 * handed in through this interface. Transforms prune nodes and times in place,
 * so implementations must return and accept their own arrays.
 */
public interface Trajectory
{
	/**
	 * @return 2 or 3
	 */
	public int numDimensions();

	/**
	 * @return the number of nodes currently held
	 */
	public int numNodes();

	/**
	 * @return the number of readout lines (e.g. spokes of a radial trajectory)
	 */
	public int numProfiles();

	public int numSamplesPerProfile();

	/**
	 * @return the number of slices (partitions) this trajectory encodes, 1 for a 2d trajectory
	 */
	public default int numSlices() { return 1; }

	/**
	 * @return true as long as the nodes form the designed regular grid
	 */
	public boolean isCartesian();

	public void setCartesian( final boolean cartesian );

	/**
	 * @return the nodes as [ numNodes ][ numDimensions ], normalized to [-0.5, 0.5) per axis for a fully sampled grid
	 */
	public double[][] getNodes();

	public void setNodes( final double[][] nodes );

	/**
	 * @return the readout time of each node
	 */
	public double[] getReadoutTimes();

	public void setReadoutTimes( final double[] times );

	/**
	 * @return an independent deep copy
	 */
	public Trajectory copy();
}
