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
 * A trajectory made of explicitly given nodes, e.g. measured or produced by an
 * external sequence simulation.
 */
public class CustomTrajectory extends AbstractTrajectory
{
	public CustomTrajectory(
			final double[][] nodes,
			final double[] times,
			final int numProfiles,
			final int numSamplesPerProfile,
			final int numSlices,
			final boolean cartesian )
	{
		super( nodes, times, nodes.length == 0 ? 2 : nodes[ 0 ].length, numProfiles, numSamplesPerProfile, numSlices, cartesian );
	}

	/**
	 * A single-slice trajectory with one profile per node.
	 *
	 * @param nodes - [ numNodes ][ numDimensions ]
	 * @param times - readout time per node
	 */
	public CustomTrajectory( final double[][] nodes, final double[] times )
	{
		this( nodes, times, Math.max( 1, nodes.length ), 1, 1, false );
	}

	/**
	 * A single-slice trajectory whose readout times are all zero.
	 *
	 * @param nodes - [ numNodes ][ numDimensions ]
	 */
	public CustomTrajectory( final double[][] nodes )
	{
		this( nodes, new double[ nodes.length ] );
	}

	@Override
	public CustomTrajectory copy()
	{
		return new CustomTrajectory( copyNodes( nodes ), times.clone(), numProfiles, numSamplesPerProfile, numSlices, cartesian );
	}
}
