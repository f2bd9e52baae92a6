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

import java.util.List;

import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.preibisch.mrrecon.acquisition.AcquisitionData;
import net.preibisch.mrrecon.acquisition.ShapeMismatchException;

/**
 * Applies per-sample weights (e.g. from {@link SamplingDensity}) to the k-space data of all coils,
 * slices and repetitions of an echo.
 */
public class DensityWeighting
{
	protected enum Mode { MULTIPLY, DIVIDE, DIVIDE_SQUARED };

	/**
	 * Multiplies the k-space data with the weights, in place.
	 */
	public static void weightData( final AcquisitionData data, final List< double[] > weights )
	{
		apply( data, weights, Mode.MULTIPLY );
	}

	/**
	 * @return a copy of the acquisition whose k-space data is multiplied with the weights
	 */
	public static AcquisitionData weightedData( final AcquisitionData data, final List< double[] > weights )
	{
		final AcquisitionData weighted = data.copy();
		weightData( weighted, weights );
		return weighted;
	}

	/**
	 * Divides the k-space data by the weights, in place. Samples with a weight of 0 are set to 0.
	 */
	public static void unweightData( final AcquisitionData data, final List< double[] > weights )
	{
		apply( data, weights, Mode.DIVIDE );
	}

	/**
	 * Divides the k-space data by the squared weights, in place. Samples with a weight of 0 are set to 0.
	 */
	public static void unweightDataSquared( final AcquisitionData data, final List< double[] > weights )
	{
		apply( data, weights, Mode.DIVIDE_SQUARED );
	}

	protected static void apply( final AcquisitionData data, final List< double[] > weights, final Mode mode )
	{
		if ( weights.size() != data.numEchoes() )
			throw new ShapeMismatchException( "Got " + weights.size() + " weight vectors for " + data.numEchoes() + " echoes." );

		for ( int echo = 0; echo < data.numEchoes(); ++echo )
			if ( weights.get( echo ).length != data.numSamples( echo ) )
				throw new ShapeMismatchException( "Got " + weights.get( echo ).length + " weights for the " + data.numSamples( echo ) +
						" samples of echo " + echo );

		for ( int rep = 0; rep < data.numReps(); ++rep )
			for ( int slice = 0; slice < data.numSlices(); ++slice )
				for ( int echo = 0; echo < data.numEchoes(); ++echo )
					apply( data.getKData().get( echo, slice, rep ), weights.get( echo ), mode );
	}

	protected static void apply( final Img< ComplexDoubleType > cell, final double[] weights, final Mode mode )
	{
		final RandomAccess< ComplexDoubleType > ra = cell.randomAccess();

		for ( int coil = 0; coil < cell.dimension( 1 ); ++coil )
		{
			ra.setPosition( coil, 1 );

			for ( int s = 0; s < weights.length; ++s )
			{
				ra.setPosition( s, 0 );

				final double w = weights[ s ];
				final double f;

				switch ( mode )
				{
					case MULTIPLY:
						f = w;
						break;
					case DIVIDE:
						f = w == 0 ? 0 : 1.0 / w;
						break;
					default:
						f = w == 0 ? 0 : 1.0 / ( w * w );
						break;
				}

				ra.get().mul( f );
			}
		}
	}
}
