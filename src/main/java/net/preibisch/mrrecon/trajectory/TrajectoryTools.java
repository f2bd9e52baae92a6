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

public class TrajectoryTools
{
	/**
	 * Restricts a trajectory to the nodes (and readout times) at the given positions, in the given order.
	 * Readout times are only pruned if there is one per node.
	 *
	 * @param tr - the trajectory, modified in place
	 * @param idx - positions of the nodes to keep
	 */
	public static void subsample( final Trajectory tr, final int[] idx )
	{
		final double[] times = tr.getReadoutTimes();
		final boolean pruneTimes = times.length == tr.numNodes();

		tr.setNodes( select( tr.getNodes(), idx ) );

		if ( pruneTimes )
			tr.setReadoutTimes( select( times, idx ) );
	}

	public static double[][] select( final double[][] nodes, final int[] idx )
	{
		final double[][] selected = new double[ idx.length ][];

		for ( int i = 0; i < idx.length; ++i )
			selected[ i ] = nodes[ idx[ i ] ];

		return selected;
	}

	public static double[] select( final double[] values, final int[] idx )
	{
		final double[] selected = new double[ idx.length ];

		for ( int i = 0; i < idx.length; ++i )
			selected[ i ] = values[ idx[ i ] ];

		return selected;
	}
}
