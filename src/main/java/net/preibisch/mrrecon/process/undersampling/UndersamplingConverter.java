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
package net.preibisch.mrrecon.process.undersampling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.mrrecon.acquisition.AcquisitionData;
import net.preibisch.mrrecon.trajectory.Trajectory;
import net.preibisch.mrrecon.trajectory.TrajectoryTools;

public class UndersamplingConverter
{
	private static final Logger LOG = LoggerFactory.getLogger( UndersamplingConverter.class );

	/**
	 * Converts undersampled {@link AcquisitionData}, where only the nodes listed in the subsample indices
	 * were measured, into a representation where the trajectories only contain the measured nodes.
	 *
	 * All coils, slices and repetitions of an echo are assumed to share the same sampling pattern.
	 *
	 * @param data - the undersampled acquisition, it is not modified
	 * @return a deep copy with pruned (non-cartesian) trajectories and identity subsample indices
	 */
	public static AcquisitionData convertUndersampledData( final AcquisitionData data )
	{
		final AcquisitionData dataSub = data.copy();

		for ( int echo = 0; echo < dataSub.numEchoes(); ++echo )
		{
			final Trajectory tr = dataSub.getTrajectory( echo );
			final int[] idx = dataSub.getSubsampleIndices( echo );
			final int numNodes = tr.numNodes();

			// assume that coils and slices experience the same trajectory
			TrajectoryTools.subsample( tr, idx );
			tr.setCartesian( false );

			dataSub.setSubsampleIndices( echo, AcquisitionData.identity( idx.length ) );

			LOG.debug( "echo {}: kept {} of {} nodes", echo, idx.length, numNodes );
		}

		LOG.info( "Converted undersampled data with {} echoes", dataSub.numEchoes() );

		return dataSub;
	}
}
