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
package net.preibisch.mrrecon;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Threads
{
	private static final Logger LOG = LoggerFactory.getLogger( Threads.class );

	public static final String numThreadsProperty = "mrrecon.threads";

	/**
	 * @return num threads for the executorService, the value of the system property
	 * {@value #numThreadsProperty} if set, otherwise the number of available processors
	 */
	public static int numThreads()
	{
		final String value = System.getProperty( numThreadsProperty );

		if ( value != null )
		{
			try
			{
				return Math.max( 1, Integer.parseInt( value.trim() ) );
			}
			catch ( final NumberFormatException e )
			{
				LOG.warn( "Ignoring invalid value '{}' of system property {}", value, numThreadsProperty );
			}
		}

		return Math.max( 1, Runtime.getRuntime().availableProcessors() );
	}

	public static ExecutorService createFixedExecutorService( final int nThreads ) { return Executors.newFixedThreadPool( nThreads ); }
	public static ExecutorService createFixedExecutorService() { return createFixedExecutorService( numThreads() ); }

	/**
	 * Runs all tasks and waits for them. The first failing task (in submission order) determines
	 * the exception that is thrown, runtime exceptions and errors are rethrown as they are.
	 *
	 * @param tasks - the tasks to run
	 * @param taskExecutor - the executor to run them on
	 * @param jobDescription - what is computed, used in error messages
	 * @param <T> - the result type of the tasks
	 * @return the results in the order of the tasks
	 */
	public static < T > List< T > execTasks( final List< ? extends Callable< T > > tasks, final ExecutorService taskExecutor, final String jobDescription )
	{
		final ArrayList< T > results = new ArrayList<>();

		try
		{
			// invokeAll() returns when all tasks are complete
			final List< Future< T > > futures = taskExecutor.invokeAll( tasks );

			for ( final Future< T > future : futures )
				results.add( future.get() );
		}
		catch ( final InterruptedException e )
		{
			Thread.currentThread().interrupt();
			throw new RuntimeException( "Interrupted while trying to " + jobDescription, e );
		}
		catch ( final ExecutionException e )
		{
			final Throwable cause = e.getCause();

			if ( cause instanceof RuntimeException )
				throw (RuntimeException)cause;
			else if ( cause instanceof Error )
				throw (Error)cause;
			else
				throw new RuntimeException( "Failed to " + jobDescription + ": " + cause, cause );
		}

		return results;
	}
}
