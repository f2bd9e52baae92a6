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

import java.util.ArrayList;
import java.util.List;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.util.IntervalIndexer;

/**
 * The measured k-space data of an acquisition. A cube over [ echo, slice, repetition ]
 * whose cells are matrices [ numSamples(echo), numCoils ], the sample index varying fastest.
 */
public class KDataCube
{
	final int[] dimensions;
	final List< Img< ComplexDoubleType > > cells;

	public KDataCube( final int numEchoes, final int numSlices, final int numReps )
	{
		if ( numEchoes < 1 || numSlices < 1 || numReps < 1 )
			throw new ShapeMismatchException(
					"A kdata cube needs at least one echo, slice and repetition, got [" + numEchoes + ", " + numSlices + ", " + numReps + "]" );

		this.dimensions = new int[] { numEchoes, numSlices, numReps };

		final int n = numEchoes * numSlices * numReps;
		this.cells = new ArrayList<>( n );

		for ( int i = 0; i < n; ++i )
			this.cells.add( null );
	}

	public int numEchoes() { return dimensions[ 0 ]; }
	public int numSlices() { return dimensions[ 1 ]; }
	public int numReps() { return dimensions[ 2 ]; }

	public Img< ComplexDoubleType > get( final int echo, final int slice, final int rep )
	{
		return cells.get( index( echo, slice, rep ) );
	}

	public void set( final int echo, final int slice, final int rep, final Img< ComplexDoubleType > data )
	{
		if ( data != null && data.numDimensions() != 2 )
			throw new ShapeMismatchException( "kdata of echo=" + echo + ", slice=" + slice + ", rep=" + rep +
					" must be a [numSamples, numCoils] matrix, but has " + data.numDimensions() + " dimensions." );

		cells.set( index( echo, slice, rep ), data );
	}

	/**
	 * @return a deep copy, every cell is copied
	 */
	public KDataCube copy()
	{
		final KDataCube copy = new KDataCube( numEchoes(), numSlices(), numReps() );

		for ( int i = 0; i < cells.size(); ++i )
		{
			final Img< ComplexDoubleType > cell = cells.get( i );
			copy.cells.set( i, cell == null ? null : cell.copy() );
		}

		return copy;
	}

	protected int index( final int echo, final int slice, final int rep )
	{
		checkIndex( echo, numEchoes(), "echo" );
		checkIndex( slice, numSlices(), "slice" );
		checkIndex( rep, numReps(), "repetition" );

		return IntervalIndexer.positionToIndex( new int[] { echo, slice, rep }, dimensions );
	}

	public static void checkIndex( final int index, final int size, final String what )
	{
		if ( index < 0 || index >= size )
			throw new IndexOutOfBoundsException( what + " index " + index + " is out of range [0, " + ( size - 1 ) + "]" );
	}
}
