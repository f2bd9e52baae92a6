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

import java.util.HashMap;

import net.preibisch.mrrecon.acquisition.DegenerateInputException;
import net.preibisch.mrrecon.acquisition.ShapeMismatchException;

/**
 * Estimates the sampling density by counting the nodes that fall into the same cell of
 * the oversampled grid, every node is weighted by one over the count of its cell. A coarse
 * replacement for the iterative density estimation of a real NFFT, the kernel is not evaluated.
 */
public class BinningDensityPlan implements NFFTPlan
{
	final double[][] nodes;
	final long[] gridSize;

	public BinningDensityPlan( final double[][] nodes, final int[] shape, final double oversamplingFactor )
	{
		if ( nodes.length == 0 )
			throw new DegenerateInputException( "Cannot estimate the sampling density of an empty set of nodes." );

		final int n = nodes[ 0 ].length;

		if ( shape.length < n )
			throw new ShapeMismatchException( "The image shape has " + shape.length + " dimensions, the nodes have " + n );

		this.nodes = nodes;
		this.gridSize = new long[ n ];

		for ( int d = 0; d < n; ++d )
			gridSize[ d ] = Math.max( 1, (long)Math.ceil( oversamplingFactor * shape[ d ] ) );
	}

	@Override
	public int numNodes() { return nodes.length; }

	@Override
	public double[] estimateDensity()
	{
		final long[] cells = new long[ nodes.length ];
		final HashMap< Long, Integer > counts = new HashMap<>();

		for ( int i = 0; i < nodes.length; ++i )
		{
			cells[ i ] = cell( nodes[ i ] );
			counts.merge( cells[ i ], 1, Integer::sum );
		}

		final double[] weights = new double[ nodes.length ];

		for ( int i = 0; i < nodes.length; ++i )
			weights[ i ] = 1.0 / counts.get( cells[ i ] );

		return weights;
	}

	protected long cell( final double[] node )
	{
		long index = 0;

		for ( int d = gridSize.length - 1; d >= 0; --d )
		{
			final long c = Math.min( gridSize[ d ] - 1, Math.max( 0, (long)Math.floor( ( node[ d ] + 0.5 ) * gridSize[ d ] ) ) );
			index = index * gridSize[ d ] + c;
		}

		return index;
	}
}
