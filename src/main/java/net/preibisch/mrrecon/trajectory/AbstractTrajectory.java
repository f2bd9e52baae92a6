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
package net.preibisch.mrrecon.trajectory;

import java.util.Arrays;

public abstract class AbstractTrajectory implements Trajectory
{
	final int numDimensions;
	final int numProfiles;
	final int numSamplesPerProfile;
	final int numSlices;

	double[][] nodes;
	double[] times;
	boolean cartesian;

	public AbstractTrajectory(
			final double[][] nodes,
			final double[] times,
			final int numDimensions,
			final int numProfiles,
			final int numSamplesPerProfile,
			final int numSlices,
			final boolean cartesian )
	{
		if ( numDimensions != 2 && numDimensions != 3 )
			throw new IllegalArgumentException( "Trajectories are 2d or 3d, but numDimensions=" + numDimensions );

		if ( numProfiles < 1 || numSamplesPerProfile < 1 || numSlices < 1 )
			throw new IllegalArgumentException(
					"numProfiles=" + numProfiles + ", numSamplesPerProfile=" + numSamplesPerProfile + ", numSlices=" + numSlices + " must be positive." );

		this.numDimensions = numDimensions;
		this.numProfiles = numProfiles;
		this.numSamplesPerProfile = numSamplesPerProfile;
		this.numSlices = numSlices;
		this.cartesian = cartesian;

		setNodes( nodes );
		setReadoutTimes( times );

		if ( times.length != nodes.length )
			throw new IllegalArgumentException( "Got " + times.length + " readout times for " + nodes.length + " nodes." );
	}

	@Override
	public int numDimensions() { return numDimensions; }

	@Override
	public int numNodes() { return nodes.length; }

	@Override
	public int numProfiles() { return numProfiles; }

	@Override
	public int numSamplesPerProfile() { return numSamplesPerProfile; }

	@Override
	public int numSlices() { return numSlices; }

	@Override
	public boolean isCartesian() { return cartesian; }

	@Override
	public void setCartesian( final boolean cartesian ) { this.cartesian = cartesian; }

	@Override
	public double[][] getNodes() { return nodes; }

	@Override
	public double[] getReadoutTimes() { return times; }

	/**
	 * Every node needs {@link #numDimensions()} coordinates. The number of nodes may differ from the
	 * readout times until both have been replaced.
	 */
	@Override
	public void setNodes( final double[][] nodes )
	{
		if ( nodes == null )
			throw new NullPointerException( "nodes must not be null." );

		for ( int i = 0; i < nodes.length; ++i )
			if ( nodes[ i ].length != numDimensions )
				throw new IllegalArgumentException( "Node " + i + " has " + nodes[ i ].length + " coordinates, expected " + numDimensions );

		this.nodes = nodes;
	}

	@Override
	public void setReadoutTimes( final double[] times )
	{
		if ( times == null )
			throw new NullPointerException( "times must not be null." );

		this.times = times;
	}

	protected static double[][] copyNodes( final double[][] nodes )
	{
		final double[][] copy = new double[ nodes.length ][];

		for ( int i = 0; i < nodes.length; ++i )
			copy[ i ] = nodes[ i ].clone();

		return copy;
	}

	@Override
	public String toString()
	{
		return getClass().getSimpleName() + "[dims=" + numDimensions + ", nodes=" + numNodes() + ", profiles=" + numProfiles +
				", samplesPerProfile=" + numSamplesPerProfile + ", slices=" + numSlices + ", cartesian=" + cartesian + "]";
	}

	/**
	 * @return true if both trajectories hold the same nodes and times
	 */
	public boolean sameNodes( final Trajectory other )
	{
		if ( other.numNodes() != numNodes() )
			return false;

		final double[][] otherNodes = other.getNodes();

		for ( int i = 0; i < nodes.length; ++i )
			if ( !Arrays.equals( nodes[ i ], otherNodes[ i ] ) )
				return false;

		return Arrays.equals( times, other.getReadoutTimes() );
	}
}
