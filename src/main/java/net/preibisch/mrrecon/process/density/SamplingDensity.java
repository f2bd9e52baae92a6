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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.mrrecon.Threads;
import net.preibisch.mrrecon.acquisition.AcquisitionData;
import net.preibisch.mrrecon.trajectory.TrajectoryTools;

/**
 * Density compensation weights for every echo of an acquisition. The weights are the square
 * root of the density estimate of a {@link NFFTPlan}, so that they can be applied symmetrically
 * in the forward and adjoint operator.
 */
public class SamplingDensity
{
	private static final Logger LOG = LoggerFactory.getLogger( SamplingDensity.class );

	public static final int KERNEL_SUPPORT = 3;
	public static final double OVERSAMPLING_FACTOR = 1.25;

	/**
	 * @param data - the acquisition
	 * @param shape - the image size the weights are computed for
	 * @param planFactory - creates the NFFT plans
	 * @return one weight vector per echo, as long as the number of measured samples of that echo
	 */
	public static List< double[] > samplingDensity( final AcquisitionData data, final int[] shape, final NFFTPlanFactory planFactory )
	{
		final ExecutorService service = Threads.createFixedExecutorService( Math.min( data.numEchoes(), Threads.numThreads() ) );

		try
		{
			return samplingDensity( data, shape, planFactory, service );
		}
		finally
		{
			service.shutdown();
		}
	}

	/**
	 * @param data - the acquisition
	 * @param shape - the image size the weights are computed for
	 * @param planFactory - creates the NFFT plans
	 * @param service - the echoes are processed in parallel on this service
	 * @return one weight vector per echo, as long as the number of measured samples of that echo
	 */
	public static List< double[] > samplingDensity(
			final AcquisitionData data,
			final int[] shape,
			final NFFTPlanFactory planFactory,
			final ExecutorService service )
	{
		final ArrayList< Callable< double[] > > tasks = new ArrayList<>();

		for ( int echo = 0; echo < data.numEchoes(); ++echo )
		{
			final double[][] nodes = TrajectoryTools.select( data.getTrajectory( echo ).getNodes(), data.getSubsampleIndices( echo ) );
			final int e = echo;

			tasks.add( () ->
			{
				final NFFTPlan plan = planFactory.create( nodes, shape, KERNEL_SUPPORT, OVERSAMPLING_FACTOR );
				final double[] weights = sqrt( plan.estimateDensity() );

				LOG.debug( "echo {}: computed {} density weights", e, weights.length );

				return weights;
			} );
		}

		final List< double[] > weights = Threads.execTasks( tasks, service, "compute sampling density" );

		LOG.info( "Computed sampling density for {} echoes", weights.size() );

		return weights;
	}

	/**
	 * @return the element-wise square root, negative and NaN values become 0
	 */
	public static double[] sqrt( final double[] density )
	{
		final double[] weights = new double[ density.length ];

		for ( int i = 0; i < density.length; ++i )
			weights[ i ] = density[ i ] > 0 ? Math.sqrt( density[ i ] ) : 0;

		return weights;
	}
}
