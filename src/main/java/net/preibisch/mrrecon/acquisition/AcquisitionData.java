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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.preibisch.mrrecon.trajectory.Trajectory;

/**
 * All information about an acquisition: the trajectory of every echo, the measured
 * k-space data (see {@link KDataCube}), which nodes of each trajectory were actually
 * sampled, and the encoding size and field of view the data is reconstructed at.
 *
 * The k-space data of an echo holds one row per entry of its subsample indices, i.e.
 * {@code kdata[e,s,r]} is [ subsampleIndices(e).length, numCoils ].
 */
public class AcquisitionData
{
	final Map< String, Object > sequenceInfo;
	final List< Trajectory > trajectories;
	KDataCube kdata;

	final int numEchoes, numCoils, numSlices, numReps;

	final List< int[] > subsampleIndices;
	int[] encodingSize;
	final double[] fov;

	protected AcquisitionData(
			final Map< String, Object > sequenceInfo,
			final List< Trajectory > trajectories,
			final KDataCube kdata,
			final int numEchoes,
			final int numCoils,
			final int numSlices,
			final int numReps,
			final List< int[] > subsampleIndices,
			final int[] encodingSize,
			final double[] fov )
	{
		this.sequenceInfo = sequenceInfo;
		this.trajectories = trajectories;
		this.kdata = kdata;
		this.numEchoes = numEchoes;
		this.numCoils = numCoils;
		this.numSlices = numSlices;
		this.numReps = numReps;
		this.subsampleIndices = subsampleIndices;
		this.encodingSize = encodingSize;
		this.fov = fov;
	}

	public Map< String, Object > getSequenceInfo() { return sequenceInfo; }
	public List< Trajectory > getTrajectories() { return Collections.unmodifiableList( trajectories ); }
	public KDataCube getKData() { return kdata; }

	public int numEchoes() { return numEchoes; }
	public int numCoils() { return numCoils; }
	public int numSlices() { return numSlices; }
	public int numReps() { return numReps; }

	public int[] getEncodingSize() { return encodingSize; }
	public double[] getFOV() { return fov; }

	/**
	 * @return the trajectory of the first echo
	 */
	public Trajectory getTrajectory() { return getTrajectory( 0 ); }

	public Trajectory getTrajectory( final int echo )
	{
		KDataCube.checkIndex( echo, numEchoes, "echo" );
		return trajectories.get( echo );
	}

	public int[] getSubsampleIndices( final int echo )
	{
		KDataCube.checkIndex( echo, numEchoes, "echo" );
		return subsampleIndices.get( echo );
	}

	/**
	 * @return the number of samples measured for an echo, the number of rows of its k-space data
	 */
	public int numSamples( final int echo )
	{
		return getSubsampleIndices( echo ).length;
	}

	public void setSubsampleIndices( final int echo, final int[] indices )
	{
		KDataCube.checkIndex( echo, numEchoes, "echo" );
		subsampleIndices.set( echo, indices );
	}

	public void setKData( final KDataCube kdata )
	{
		if ( kdata.numEchoes() != numEchoes || kdata.numSlices() != numSlices || kdata.numReps() != numReps )
			throw new ShapeMismatchException( "kdata cube is [" + kdata.numEchoes() + ", " + kdata.numSlices() + ", " + kdata.numReps() +
					"], expected [" + numEchoes + ", " + numSlices + ", " + numReps + "]" );

		this.kdata = kdata;
	}

	public void setEncodingSize( final int[] encodingSize )
	{
		if ( encodingSize.length != 3 )
			throw new ShapeMismatchException( "encodingSize needs 3 components, got " + encodingSize.length );

		this.encodingSize = encodingSize;
	}

	/**
	 * The spacing of the reconstructed pixels in mm. Fixed, scaling by fov/encodingSize is not performed.
	 *
	 * @return {1, 1, 1}
	 */
	public double[] pixelSpacing()
	{
		return new double[] { 1.0, 1.0, 1.0 };
	}

	/**
	 * Checks that counts, trajectories, subsample indices and the k-space data are consistent.
	 *
	 * @throws ShapeMismatchException if they are not
	 */
	public void validate()
	{
		if ( numEchoes < 1 || numCoils < 1 || numSlices < 1 || numReps < 1 )
			throw new ShapeMismatchException( "numEchoes=" + numEchoes + ", numCoils=" + numCoils + ", numSlices=" + numSlices +
					", numReps=" + numReps + " must be positive." );

		if ( trajectories.size() != numEchoes )
			throw new ShapeMismatchException( "Got " + trajectories.size() + " trajectories for " + numEchoes + " echoes." );

		if ( subsampleIndices.size() != numEchoes )
			throw new ShapeMismatchException( "Got " + subsampleIndices.size() + " subsample index sets for " + numEchoes + " echoes." );

		if ( encodingSize == null || encodingSize.length != 3 )
			throw new ShapeMismatchException( "encodingSize needs 3 components." );

		if ( fov == null || fov.length != 3 )
			throw new ShapeMismatchException( "fov needs 3 components." );

		if ( kdata.numEchoes() != numEchoes || kdata.numSlices() != numSlices || kdata.numReps() != numReps )
			throw new ShapeMismatchException( "kdata cube is [" + kdata.numEchoes() + ", " + kdata.numSlices() + ", " + kdata.numReps() +
					"], expected [" + numEchoes + ", " + numSlices + ", " + numReps + "]" );

		for ( int echo = 0; echo < numEchoes; ++echo )
		{
			final int numNodes = trajectories.get( echo ).numNodes();
			final int[] indices = subsampleIndices.get( echo );
			final boolean[] used = new boolean[ numNodes ];

			for ( final int i : indices )
			{
				if ( i < 0 || i >= numNodes )
					throw new ShapeMismatchException( "Subsample index " + i + " of echo " + echo + " is outside of the " + numNodes + " trajectory nodes." );

				if ( used[ i ] )
					throw new ShapeMismatchException( "Subsample index " + i + " of echo " + echo + " appears more than once." );

				used[ i ] = true;
			}

			for ( int rep = 0; rep < numReps; ++rep )
				for ( int slice = 0; slice < numSlices; ++slice )
				{
					final Img< ComplexDoubleType > cell = kdata.get( echo, slice, rep );

					if ( cell == null )
						throw new ShapeMismatchException( "kdata of echo=" + echo + ", slice=" + slice + ", rep=" + rep + " is missing." );

					if ( cell.dimension( 0 ) != indices.length || cell.dimension( 1 ) != numCoils )
						throw new ShapeMismatchException( "kdata of echo=" + echo + ", slice=" + slice + ", rep=" + rep + " is [" +
								cell.dimension( 0 ) + ", " + cell.dimension( 1 ) + "], expected [" + indices.length + ", " + numCoils + "]" );
				}
		}
	}

	/**
	 * @return a deep copy that shares no mutable state with this instance (sequence info values are shared)
	 */
	public AcquisitionData copy()
	{
		final ArrayList< Trajectory > trajectoriesCopy = new ArrayList<>();

		for ( final Trajectory tr : trajectories )
			trajectoriesCopy.add( tr.copy() );

		final ArrayList< int[] > subsampleIndicesCopy = new ArrayList<>();

		for ( final int[] indices : subsampleIndices )
			subsampleIndicesCopy.add( indices.clone() );

		return new AcquisitionData(
				new HashMap<>( sequenceInfo ),
				trajectoriesCopy,
				kdata.copy(),
				numEchoes,
				numCoils,
				numSlices,
				numReps,
				subsampleIndicesCopy,
				encodingSize.clone(),
				fov.clone() );
	}

	@Override
	public String toString()
	{
		return "AcquisitionData[echoes=" + numEchoes + ", coils=" + numCoils + ", slices=" + numSlices + ", reps=" + numReps +
				", encodingSize=" + encodingSize[ 0 ] + "x" + encodingSize[ 1 ] + "x" + encodingSize[ 2 ] + "]";
	}

	/**
	 * Assembles {@link AcquisitionData} from trajectories and k-space data, counts that are not set
	 * explicitly are taken from the {@link KDataCube}.
	 */
	public static class Builder
	{
		final List< Trajectory > trajectories;
		final KDataCube kdata;

		Map< String, Object > sequenceInfo = new HashMap<>();
		int numEchoes = -1, numCoils = -1, numSlices = -1, numReps = -1;
		List< int[] > subsampleIndices = null;
		int[] encodingSize = new int[] { 0, 0, 0 };
		double[] fov = new double[] { 0, 0, 0 };

		/**
		 * @param trajectory - used for all echoes, every echo gets its own copy
		 * @param kdata - the measured data
		 */
		public Builder( final Trajectory trajectory, final KDataCube kdata )
		{
			this.trajectories = new ArrayList<>();
			this.trajectories.add( trajectory );
			this.kdata = kdata;
		}

		/**
		 * @param trajectories - one per echo
		 * @param kdata - the measured data
		 */
		public Builder( final List< ? extends Trajectory > trajectories, final KDataCube kdata )
		{
			this.trajectories = new ArrayList<>( trajectories );
			this.kdata = kdata;
		}

		public Builder sequenceInfo( final Map< String, Object > sequenceInfo ) { this.sequenceInfo = new HashMap<>( sequenceInfo ); return this; }
		public Builder numEchoes( final int numEchoes ) { this.numEchoes = numEchoes; return this; }
		public Builder numCoils( final int numCoils ) { this.numCoils = numCoils; return this; }
		public Builder numSlices( final int numSlices ) { this.numSlices = numSlices; return this; }
		public Builder numReps( final int numReps ) { this.numReps = numReps; return this; }
		public Builder encodingSize( final int... encodingSize ) { this.encodingSize = encodingSize.clone(); return this; }
		public Builder fov( final double... fov ) { this.fov = fov.clone(); return this; }

		/**
		 * @param subsampleIndices - for every echo the positions of the measured nodes in its trajectory
		 */
		public Builder subsampleIndices( final List< int[] > subsampleIndices )
		{
			this.subsampleIndices = new ArrayList<>();

			for ( final int[] indices : subsampleIndices )
				this.subsampleIndices.add( indices.clone() );

			return this;
		}

		/**
		 * @return the validated {@link AcquisitionData}
		 * @throws ShapeMismatchException if the pieces do not fit together
		 */
		public AcquisitionData build()
		{
			final int numEchoes = this.numEchoes > 0 ? this.numEchoes : kdata.numEchoes();
			final int numSlices = this.numSlices > 0 ? this.numSlices : kdata.numSlices();
			final int numReps = this.numReps > 0 ? this.numReps : kdata.numReps();

			final int numCoils;

			if ( this.numCoils > 0 )
				numCoils = this.numCoils;
			else if ( kdata.get( 0, 0, 0 ) != null )
				numCoils = (int)kdata.get( 0, 0, 0 ).dimension( 1 );
			else
				numCoils = 1;

			final ArrayList< Trajectory > tr = new ArrayList<>( trajectories );

			if ( tr.size() == 1 )
				for ( int echo = 1; echo < numEchoes; ++echo )
					tr.add( trajectories.get( 0 ).copy() );

			final List< int[] > indices;

			if ( subsampleIndices != null )
			{
				indices = subsampleIndices;
			}
			else
			{
				indices = new ArrayList<>();

				for ( int echo = 0; echo < Math.min( numEchoes, tr.size() ); ++echo )
					indices.add( identity( tr.get( echo ).numNodes() ) );
			}

			final AcquisitionData data = new AcquisitionData(
					sequenceInfo, tr, kdata, numEchoes, numCoils, numSlices, numReps, indices, encodingSize, fov );

			data.validate();

			return data;
		}
	}

	/**
	 * @return { 0, 1, ..., n-1 }
	 */
	public static int[] identity( final int n )
	{
		final int[] indices = new int[ n ];

		for ( int i = 0; i < n; ++i )
			indices[ i ] = i;

		return indices;
	}
}
