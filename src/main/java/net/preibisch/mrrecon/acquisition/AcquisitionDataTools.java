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

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.view.Views;
import net.preibisch.mrrecon.trajectory.Trajectory;

/**
 * Views on the k-space data of an {@link AcquisitionData} for one or several echoes and coils.
 * All methods return newly allocated images, they never alias the data of the acquisition.
 */
public class AcquisitionDataTools
{
	public static Trajectory trajectory( final AcquisitionData data, final int echo )
	{
		return data.getTrajectory( echo );
	}

	public static Img< ComplexDoubleType > kData( final AcquisitionData data, final int echo, final int coil, final int slice )
	{
		return kData( data, echo, coil, slice, 0 );
	}

	/**
	 * @return the samples of one coil, [ numSamples(echo) ]
	 */
	public static Img< ComplexDoubleType > kData( final AcquisitionData data, final int echo, final int coil, final int slice, final int rep )
	{
		final Img< ComplexDoubleType > cell = data.getKData().get( echo, slice, rep );
		KDataCube.checkIndex( coil, data.numCoils(), "coil" );

		final Img< ComplexDoubleType > out = ArrayImgs.complexDoubles( cell.dimension( 0 ) );
		copyColumn( cell, coil, out.cursor() );

		return out;
	}

	public static Img< ComplexDoubleType > multiEchoData( final AcquisitionData data, final int coil, final int slice )
	{
		return multiEchoData( data, coil, slice, 0 );
	}

	/**
	 * @return the samples of one coil for all echoes, echo after echo
	 */
	public static Img< ComplexDoubleType > multiEchoData( final AcquisitionData data, final int coil, final int slice, final int rep )
	{
		KDataCube.checkIndex( coil, data.numCoils(), "coil" );

		final ArrayList< Img< ComplexDoubleType > > cells = new ArrayList<>();
		long n = 0;

		for ( int echo = 0; echo < data.numEchoes(); ++echo )
		{
			final Img< ComplexDoubleType > cell = data.getKData().get( echo, slice, rep );
			cells.add( cell );
			n += cell.dimension( 0 );
		}

		final Img< ComplexDoubleType > out = ArrayImgs.complexDoubles( n );
		final Cursor< ComplexDoubleType > cursor = out.cursor();

		for ( final Img< ComplexDoubleType > cell : cells )
			copyColumn( cell, coil, cursor );

		return out;
	}

	public static Img< ComplexDoubleType > multiCoilData( final AcquisitionData data, final int echo, final int slice )
	{
		return multiCoilData( data, echo, slice, 0 );
	}

	/**
	 * @return the samples of all coils for one echo, all samples of coil 0 first, then coil 1, ...
	 */
	public static Img< ComplexDoubleType > multiCoilData( final AcquisitionData data, final int echo, final int slice, final int rep )
	{
		final Img< ComplexDoubleType > cell = data.getKData().get( echo, slice, rep );
		final Img< ComplexDoubleType > out = ArrayImgs.complexDoubles( cell.dimension( 0 ) * cell.dimension( 1 ) );

		final Cursor< ComplexDoubleType > cursor = out.cursor();

		// flatIterable iterates the sample dimension fastest
		for ( final ComplexDoubleType t : Views.flatIterable( cell ) )
			cursor.next().set( t );

		return out;
	}

	public static Img< ComplexDoubleType > multiCoilMultiEchoData( final AcquisitionData data, final int slice )
	{
		return multiCoilMultiEchoData( data, slice, 0 );
	}

	/**
	 * @return the samples of all coils and echoes, ordered by coil first and by echo within a coil,
	 * i.e. the {@link #multiEchoData(AcquisitionData, int, int, int)} of coil 0, then of coil 1, ...
	 */
	public static Img< ComplexDoubleType > multiCoilMultiEchoData( final AcquisitionData data, final int slice, final int rep )
	{
		long n = 0;

		for ( int echo = 0; echo < data.numEchoes(); ++echo )
			n += data.getKData().get( echo, slice, rep ).dimension( 0 );

		final Img< ComplexDoubleType > out = ArrayImgs.complexDoubles( n * data.numCoils() );
		final Cursor< ComplexDoubleType > cursor = out.cursor();

		for ( int coil = 0; coil < data.numCoils(); ++coil )
			for ( int echo = 0; echo < data.numEchoes(); ++echo )
				copyColumn( data.getKData().get( echo, slice, rep ), coil, cursor );

		return out;
	}

	/**
	 * The samples of one profile (readout line) of an echo for all coils. A 3d trajectory with several
	 * slices is stored completely in slice 0 of the k-space data, {@code slice} then selects the partition
	 * of the trajectory.
	 *
	 * @param data - the acquisition
	 * @param echo - the echo
	 * @param slice - the slice
	 * @param rep - the repetition
	 * @param profile - the profile within the trajectory
	 * @return [ numSamplesPerProfile, numCoils ]
	 */
	public static Img< ComplexDoubleType > profileData( final AcquisitionData data, final int echo, final int slice, final int rep, final int profile )
	{
		final Trajectory tr = data.getTrajectory( echo );

		final int numProfiles = tr.numProfiles();
		final int numSamp = tr.numSamplesPerProfile();
		final int numSlices = tr.numSlices();
		final int numCoils = data.numCoils();

		KDataCube.checkIndex( profile, numProfiles, "profile" );

		final boolean singleSlice = tr.numDimensions() == 2 || numSlices == 1;

		final Img< ComplexDoubleType > flat;
		final long expected;

		if ( singleSlice )
		{
			flat = multiCoilData( data, echo, slice, rep );
			expected = (long)numSamp * numProfiles * numCoils;
		}
		else
		{
			KDataCube.checkIndex( slice, numSlices, "slice" );
			flat = multiCoilData( data, echo, 0, rep );
			expected = (long)numSamp * numProfiles * numSlices * numCoils;
		}

		if ( flat.dimension( 0 ) != expected )
			throw new ShapeMismatchException( "Cannot interpret " + flat.dimension( 0 ) + " samples of echo " + echo + " as " + numSamp +
					" samples x " + numProfiles + " profiles" + ( singleSlice ? "" : " x " + numSlices + " slices" ) + " x " + numCoils + " coils." );

		final Img< ComplexDoubleType > out = ArrayImgs.complexDoubles( numSamp, numCoils );
		final RandomAccess< ComplexDoubleType > in = flat.randomAccess();
		final RandomAccess< ComplexDoubleType > ra = out.randomAccess();

		// column-major [ numSamp, numProfiles, (numSlices,) numCoils ]
		final long coilStride = singleSlice ? (long)numSamp * numProfiles : (long)numSamp * numProfiles * numSlices;
		final long offset = singleSlice ? (long)profile * numSamp : (long)profile * numSamp + (long)slice * numSamp * numProfiles;

		for ( int coil = 0; coil < numCoils; ++coil )
		{
			ra.setPosition( coil, 1 );

			for ( int s = 0; s < numSamp; ++s )
			{
				in.setPosition( offset + coil * coilStride + s, 0 );
				ra.setPosition( s, 0 );
				ra.get().set( in.get() );
			}
		}

		return out;
	}

	/**
	 * @return an independent {@link AcquisitionData} that contains only one slice and repetition
	 */
	public static AcquisitionData singleSliceData( final AcquisitionData data, final int slice )
	{
		return singleSliceData( data, slice, 0 );
	}

	/**
	 * @return an independent {@link AcquisitionData} that contains only one slice and repetition
	 */
	public static AcquisitionData singleSliceData( final AcquisitionData data, final int slice, final int rep )
	{
		final KDataCube kdata = new KDataCube( data.numEchoes(), 1, 1 );
		final ArrayList< Trajectory > trajectories = new ArrayList<>();
		final ArrayList< int[] > subsampleIndices = new ArrayList<>();

		for ( int echo = 0; echo < data.numEchoes(); ++echo )
		{
			kdata.set( echo, 0, 0, data.getKData().get( echo, slice, rep ).copy() );
			trajectories.add( data.getTrajectory( echo ).copy() );
			subsampleIndices.add( data.getSubsampleIndices( echo ).clone() );
		}

		return new AcquisitionData.Builder( trajectories, kdata )
				.sequenceInfo( data.getSequenceInfo() )
				.numCoils( data.numCoils() )
				.subsampleIndices( subsampleIndices )
				.encodingSize( data.getEncodingSize() )
				.fov( data.getFOV() )
				.build();
	}

	/**
	 * Writes column {@code coil} of a [ numSamples, numCoils ] matrix into the next numSamples positions of a cursor.
	 */
	protected static void copyColumn( final Img< ComplexDoubleType > cell, final int coil, final Cursor< ComplexDoubleType > target )
	{
		for ( final ComplexDoubleType t : Views.hyperSlice( cell, 1, coil ) )
			target.next().set( t );
	}
}
