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

import static net.preibisch.mrrecon.acquisition.AcquisitionDataFixtures.acquisition;
import static net.preibisch.mrrecon.acquisition.AcquisitionDataFixtures.assertSample;
import static net.preibisch.mrrecon.acquisition.AcquisitionDataFixtures.get;
import static net.preibisch.mrrecon.acquisition.AcquisitionDataFixtures.imaginary;
import static net.preibisch.mrrecon.acquisition.AcquisitionDataFixtures.real;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import net.preibisch.mrrecon.acquisition.AcquisitionData;
import net.preibisch.mrrecon.acquisition.ShapeMismatchException;

public class DensityWeightingTest
{
	static final List< double[] > weights = Arrays.asList( new double[] { 2, 0, 0.5 }, new double[] { 4, 1 } );

	@Test
	public void testWeightData()
	{
		final AcquisitionData data = acquisition( 2, 2, 2, 3, 2 );
		DensityWeighting.weightData( data, weights );

		for ( int rep = 0; rep < 2; ++rep )
			for ( int slice = 0; slice < 2; ++slice )
				for ( int echo = 0; echo < 2; ++echo )
					for ( int coil = 0; coil < 2; ++coil )
						for ( int s = 0; s < weights.get( echo ).length; ++s )
						{
							final double w = weights.get( echo )[ s ];
							assertSample( w * real( echo, slice, rep, coil, s ), w * imaginary( echo, slice, rep, coil, s ),
									get( data.getKData().get( echo, slice, rep ), s, coil ) );
						}
	}

	@Test
	public void testWeightedDataIsACopy()
	{
		final AcquisitionData data = acquisition( 1, 1, 1, 3, 2 );
		final AcquisitionData weighted = DensityWeighting.weightedData( data, weights );

		assertSample( 4 * real( 1, 0, 0, 0, 0 ), 4 * imaginary( 1, 0, 0, 0, 0 ), get( weighted.getKData().get( 1, 0, 0 ), 0, 0 ) );
		assertSample( real( 1, 0, 0, 0, 0 ), imaginary( 1, 0, 0, 0, 0 ), get( data.getKData().get( 1, 0, 0 ), 0, 0 ) );
	}

	@Test
	public void testUnweightData()
	{
		final AcquisitionData data = acquisition( 1, 1, 1, 3, 2 );
		DensityWeighting.unweightData( data, weights );

		assertSample( real( 0, 0, 0, 0, 0 ) / 2, imaginary( 0, 0, 0, 0, 0 ) / 2, get( data.getKData().get( 0, 0, 0 ), 0, 0 ) );
		assertSample( 0, 0, get( data.getKData().get( 0, 0, 0 ), 1, 0 ) );
		assertSample( real( 0, 0, 0, 0, 2 ) * 2, imaginary( 0, 0, 0, 0, 2 ) * 2, get( data.getKData().get( 0, 0, 0 ), 2, 0 ) );
		assertSample( real( 1, 0, 0, 0, 0 ) / 4, imaginary( 1, 0, 0, 0, 0 ) / 4, get( data.getKData().get( 1, 0, 0 ), 0, 0 ) );
	}

	@Test
	public void testUnweightDataSquared()
	{
		final AcquisitionData data = acquisition( 1, 1, 1, 3, 2 );
		DensityWeighting.unweightDataSquared( data, weights );

		assertSample( real( 0, 0, 0, 0, 0 ) / 4, imaginary( 0, 0, 0, 0, 0 ) / 4, get( data.getKData().get( 0, 0, 0 ), 0, 0 ) );
		assertSample( 0, 0, get( data.getKData().get( 0, 0, 0 ), 1, 0 ) );
		assertSample( real( 1, 0, 0, 0, 0 ) / 16, imaginary( 1, 0, 0, 0, 0 ) / 16, get( data.getKData().get( 1, 0, 0 ), 0, 0 ) );
	}

	@Test( expected = ShapeMismatchException.class )
	public void testWrongNumberOfVectors()
	{
		DensityWeighting.weightData( acquisition( 1, 1, 1, 3, 2 ), Collections.singletonList( new double[ 3 ] ) );
	}

	@Test( expected = ShapeMismatchException.class )
	public void testWrongVectorLength()
	{
		DensityWeighting.weightData( acquisition( 1, 1, 1, 3 ), Collections.singletonList( new double[ 2 ] ) );
	}
}
