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
package net.preibisch.mrrecon.process.resizing;

import java.util.ArrayList;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.preibisch.mrrecon.acquisition.AcquisitionData;
import net.preibisch.mrrecon.acquisition.DegenerateInputException;
import net.preibisch.mrrecon.acquisition.KDataCube;
import net.preibisch.mrrecon.acquisition.ShapeMismatchException;
import net.preibisch.mrrecon.trajectory.Trajectory;
import net.preibisch.mrrecon.trajectory.TrajectoryTools;

/**
 * Adapts {@link AcquisitionData} to a reconstruction at a different encoding size (resolution)
 * in the first two dimensions. Nodes are rescaled by oldSize/newSize, nodes that leave
 * [-0.5, 0.5) in x or y are removed together with their samples, and the remaining samples
 * are scaled by 1/(facX*facY).
 */
public class EncodingSize
{
	private static final Logger LOG = LoggerFactory.getLogger( EncodingSize.class );

	public static final double minNode = -0.5;
	public static final double maxNode = 0.5;

	/**
	 * @param data - the acquisition, it is not modified
	 * @param newEncodingSize - the new encoding size, 2 or 3 components, x and y must be positive
	 * @return a resized deep copy
	 */
	public static AcquisitionData changeEncodingSize2D( final AcquisitionData data, final int... newEncodingSize )
	{
		final AcquisitionData dest = data.copy();
		changeEncodingSize2DInPlace( dest, newEncodingSize );
		return dest;
	}

	/**
	 * Resizes the acquisition and its trajectories in place. All echoes are checked before anything is
	 * modified, so if an exception is thrown the data is unchanged.
	 *
	 * @param data - the acquisition, the caller must guarantee exclusive access
	 * @param newEncodingSize - the new encoding size, 2 or 3 components, x and y must be positive
	 * @return the same instance
	 */
	public static AcquisitionData changeEncodingSize2DInPlace( final AcquisitionData data, final int... newEncodingSize )
	{
		final double[] fac = scaleFactors( data.getEncodingSize(), newEncodingSize );
		final double scale = 1.0 / ( fac[ 0 ] * fac[ 1 ] );

		final int numEchoes = data.numEchoes();

		final ArrayList< double[][] > newNodes = new ArrayList<>();
		final ArrayList< double[] > newTimes = new ArrayList<>();
		final ArrayList< int[] > keptRows = new ArrayList<>();
		final ArrayList< int[] > newSubsampleIndices = new ArrayList<>();

		for ( int echo = 0; echo < numEchoes; ++echo )
		{
			final Trajectory tr = data.getTrajectory( echo );
			final double[][] nodes = scaleNodes( tr.getNodes(), fac );

			// filter out nodes outside of [-0.5, 0.5)
			final int[] idx = intersect( findInside( nodes, 0 ), findInside( nodes, 1 ) );

			// new position of every old node, -1 if it is removed
			final int[] newPosition = new int[ nodes.length ];
			Arrays.fill( newPosition, -1 );

			for ( int i = 0; i < idx.length; ++i )
				newPosition[ idx[ i ] ] = i;

			final int[] subsampleIndices = data.getSubsampleIndices( echo );
			final int[] rows = new int[ subsampleIndices.length ];
			final int[] indices = new int[ subsampleIndices.length ];
			int numRows = 0;

			for ( int r = 0; r < subsampleIndices.length; ++r )
			{
				final int pos = newPosition[ subsampleIndices[ r ] ];

				if ( pos >= 0 )
				{
					rows[ numRows ] = r;
					indices[ numRows ] = pos;
					++numRows;
				}
			}

			if ( numRows == 0 )
				throw new DegenerateInputException( "No samples of echo " + echo + " remain after changing the encoding size from " +
						Arrays.toString( data.getEncodingSize() ) + " to " + Arrays.toString( newEncodingSize ) );

			final double[] times = tr.getReadoutTimes();

			newNodes.add( TrajectoryTools.select( nodes, idx ) );
			newTimes.add( times.length == nodes.length ? TrajectoryTools.select( times, idx ) : times );
			keptRows.add( Arrays.copyOf( rows, numRows ) );
			newSubsampleIndices.add( Arrays.copyOf( indices, numRows ) );

			LOG.debug( "echo {}: {} of {} nodes and {} of {} samples remain", echo, idx.length, nodes.length, numRows, subsampleIndices.length );
		}

		// find relevant kspace data
		final KDataCube kdata = new KDataCube( numEchoes, data.numSlices(), data.numReps() );

		for ( int rep = 0; rep < data.numReps(); ++rep )
			for ( int slice = 0; slice < data.numSlices(); ++slice )
				for ( int echo = 0; echo < numEchoes; ++echo )
					kdata.set( echo, slice, rep, selectRows( data.getKData().get( echo, slice, rep ), keptRows.get( echo ), scale ) );

		for ( int echo = 0; echo < numEchoes; ++echo )
		{
			final Trajectory tr = data.getTrajectory( echo );
			tr.setNodes( newNodes.get( echo ) );
			tr.setReadoutTimes( newTimes.get( echo ) );
			data.setSubsampleIndices( echo, newSubsampleIndices.get( echo ) );
		}

		data.setKData( kdata );

		final int[] encodingSize = data.getEncodingSize().clone();
		encodingSize[ 0 ] = newEncodingSize[ 0 ];
		encodingSize[ 1 ] = newEncodingSize[ 1 ];

		if ( newEncodingSize.length > 2 )
			encodingSize[ 2 ] = newEncodingSize[ 2 ];

		data.setEncodingSize( encodingSize );

		LOG.info( "Changed encoding size to {}, scale factors {}, {} echoes", Arrays.toString( encodingSize ), Arrays.toString( fac ), numEchoes );

		return data;
	}

	/**
	 * @return { oldX / newX, oldY / newY }
	 */
	public static double[] scaleFactors( final int[] oldEncodingSize, final int[] newEncodingSize )
	{
		if ( newEncodingSize == null || newEncodingSize.length < 2 || newEncodingSize.length > 3 )
			throw new ShapeMismatchException( "The new encoding size needs 2 or 3 components, got " + Arrays.toString( newEncodingSize ) );

		if ( newEncodingSize[ 0 ] <= 0 || newEncodingSize[ 1 ] <= 0 )
			throw new ShapeMismatchException( "The new encoding size must be positive in x and y, got " + Arrays.toString( newEncodingSize ) );

		if ( oldEncodingSize[ 0 ] <= 0 || oldEncodingSize[ 1 ] <= 0 )
			throw new ShapeMismatchException( "The encoding size of the data must be positive in x and y to be changed, but is " +
					Arrays.toString( oldEncodingSize ) );

		return new double[] {
				(double)oldEncodingSize[ 0 ] / newEncodingSize[ 0 ],
				(double)oldEncodingSize[ 1 ] / newEncodingSize[ 1 ] };
	}

	/**
	 * @return new nodes where the first fac.length coordinates are multiplied by fac
	 */
	public static double[][] scaleNodes( final double[][] nodes, final double[] fac )
	{
		final double[][] scaled = new double[ nodes.length ][];

		for ( int i = 0; i < nodes.length; ++i )
		{
			scaled[ i ] = nodes[ i ].clone();

			for ( int d = 0; d < fac.length; ++d )
				scaled[ i ][ d ] *= fac[ d ];
		}

		return scaled;
	}

	/**
	 * @return the ascending indices of all nodes whose coordinate d lies in [-0.5, 0.5)
	 */
	public static int[] findInside( final double[][] nodes, final int d )
	{
		final int[] idx = new int[ nodes.length ];
		int n = 0;

		for ( int i = 0; i < nodes.length; ++i )
		{
			final double x = nodes[ i ][ d ];

			if ( x >= minNode && x < maxNode )
				idx[ n++ ] = i;
		}

		return Arrays.copyOf( idx, n );
	}

	/**
	 * @param a - ascending indices
	 * @param b - ascending indices
	 * @return the ascending indices contained in both
	 */
	public static int[] intersect( final int[] a, final int[] b )
	{
		final int[] idx = new int[ Math.min( a.length, b.length ) ];
		int n = 0, i = 0, j = 0;

		while ( i < a.length && j < b.length )
		{
			if ( a[ i ] < b[ j ] )
				++i;
			else if ( a[ i ] > b[ j ] )
				++j;
			else
			{
				idx[ n++ ] = a[ i ];
				++i;
				++j;
			}
		}

		return Arrays.copyOf( idx, n );
	}

	/**
	 * @return a new [ rows.length, numCoils ] matrix holding the given rows multiplied by scale
	 */
	protected static Img< ComplexDoubleType > selectRows( final Img< ComplexDoubleType > cell, final int[] rows, final double scale )
	{
		final long numCoils = cell.dimension( 1 );
		final Img< ComplexDoubleType > out = ArrayImgs.complexDoubles( rows.length, numCoils );

		final RandomAccess< ComplexDoubleType > in = cell.randomAccess();
		final RandomAccess< ComplexDoubleType > ra = out.randomAccess();

		for ( int coil = 0; coil < numCoils; ++coil )
		{
			in.setPosition( coil, 1 );
			ra.setPosition( coil, 1 );

			for ( int r = 0; r < rows.length; ++r )
			{
				in.setPosition( rows[ r ], 0 );
				ra.setPosition( r, 0 );

				final ComplexDoubleType t = ra.get();
				t.set( in.get() );
				t.mul( scale );
			}
		}

		return out;
	}
}
