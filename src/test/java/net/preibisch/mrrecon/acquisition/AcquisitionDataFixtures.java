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
package net.preibisch.mrrecon.acquisition;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.List;

import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.preibisch.mrrecon.trajectory.CustomTrajectory;
import net.preibisch.mrrecon.trajectory.Trajectory;

/**
 * Synthetic acquisitions whose samples encode their own position, see {@link #real(int, int, int, int, int)}.
 */
public class AcquisitionDataFixtures
{
	public static final double EPSILON = 1e-12;

	public static double real( final int echo, final int slice, final int rep, final int coil, final int sample )
	{
		return sample + 100 * coil + 1000 * echo + 10000 * slice + 100000 * rep;
	}

	public static double imaginary( final int echo, final int slice, final int rep, final int coil, final int sample )
	{
		return -0.5 * real( echo, slice, rep, coil, sample );
	}

	/**
	 * @param samplesPerEcho - number of rows of every echo
	 */
	public static KDataCube cube( final int numSlices, final int numReps, final int numCoils, final int... samplesPerEcho )
	{
		final KDataCube kdata = new KDataCube( samplesPerEcho.length, numSlices, numReps );

		for ( int echo = 0; echo < samplesPerEcho.length; ++echo )
			for ( int slice = 0; slice < numSlices; ++slice )
				for ( int rep = 0; rep < numReps; ++rep )
				{
					final Img< ComplexDoubleType > cell = ArrayImgs.complexDoubles( samplesPerEcho[ echo ], numCoils );
					final RandomAccess< ComplexDoubleType > ra = cell.randomAccess();

					for ( int coil = 0; coil < numCoils; ++coil )
						for ( int s = 0; s < samplesPerEcho[ echo ]; ++s )
						{
							ra.setPosition( new int[] { s, coil } );
							ra.get().set( real( echo, slice, rep, coil, s ), imaginary( echo, slice, rep, coil, s ) );
						}

					kdata.set( echo, slice, rep, cell );
				}

		return kdata;
	}

	/**
	 * @return a 2d trajectory with n nodes on the diagonal from -0.5 towards 0.5, readout time i for node i
	 */
	public static CustomTrajectory diagonal( final int n, final boolean cartesian )
	{
		final double[][] nodes = new double[ n ][];
		final double[] times = new double[ n ];

		for ( int i = 0; i < n; ++i )
		{
			final double x = -0.5 + (double)i / n;
			nodes[ i ] = new double[] { x, x };
			times[ i ] = i;
		}

		return new CustomTrajectory( nodes, times, 1, n, 1, cartesian );
	}

	/**
	 * @return a fully sampled acquisition with diagonal trajectories
	 */
	public static AcquisitionData acquisition( final int numSlices, final int numReps, final int numCoils, final int... samplesPerEcho )
	{
		final List< Trajectory > trajectories = new ArrayList<>();

		for ( final int n : samplesPerEcho )
			trajectories.add( diagonal( n, true ) );

		return new AcquisitionData.Builder( trajectories, cube( numSlices, numReps, numCoils, samplesPerEcho ) )
				.encodingSize( 4, 4, 1 )
				.fov( 200, 200, 5 )
				.build();
	}

	public static Img< ComplexDoubleType > matrix( final double[][] real )
	{
		final Img< ComplexDoubleType > img = ArrayImgs.complexDoubles( real.length, real[ 0 ].length );
		final RandomAccess< ComplexDoubleType > ra = img.randomAccess();

		for ( int s = 0; s < real.length; ++s )
			for ( int c = 0; c < real[ s ].length; ++c )
			{
				ra.setPosition( new int[] { s, c } );
				ra.get().set( real[ s ][ c ], 0 );
			}

		return img;
	}

	public static ComplexDoubleType get( final Img< ComplexDoubleType > img, final long... position )
	{
		final RandomAccess< ComplexDoubleType > ra = img.randomAccess();
		ra.setPosition( position );
		return ra.get().copy();
	}

	public static void assertSample( final double re, final double im, final ComplexDoubleType t )
	{
		assertEquals( re, t.getRealDouble(), EPSILON );
		assertEquals( im, t.getImaginaryDouble(), EPSILON );
	}
}
