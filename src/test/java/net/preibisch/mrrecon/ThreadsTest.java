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

import static org.junit.Assert.assertEquals;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class ThreadsTest
{
	ExecutorService service;

	@Before
	public void setUp()
	{
		service = Threads.createFixedExecutorService( 3 );
	}

	@After
	public void tearDown()
	{
		service.shutdown();
	}

	@Test
	public void testResultsKeepTaskOrder()
	{
		final ArrayList< Callable< Integer > > tasks = new ArrayList<>();

		for ( int i = 0; i < 10; ++i )
		{
			final int n = i;
			tasks.add( () ->
			{
				Thread.sleep( 10 - n );
				return n * n;
			} );
		}

		final List< Integer > results = Threads.execTasks( tasks, service, "square" );

		assertEquals( Arrays.asList( 0, 1, 4, 9, 16, 25, 36, 49, 64, 81 ), results );
	}

	@Test( expected = IllegalStateException.class )
	public void testRuntimeExceptionIsRethrown()
	{
		final List< Callable< Integer > > tasks = Arrays.asList( () -> 1, () -> { throw new IllegalStateException( "fail" ); } );

		Threads.execTasks( tasks, service, "fail" );
	}

	@Test
	public void testCheckedExceptionIsWrapped()
	{
		final List< Callable< Integer > > tasks = Arrays.asList( () -> { throw new IOException( "io" ); } );

		try
		{
			Threads.execTasks( tasks, service, "read" );
		}
		catch ( final RuntimeException e )
		{
			assertEquals( IOException.class, e.getCause().getClass() );
			return;
		}

		throw new AssertionError( "expected a RuntimeException" );
	}

	@Test
	public void testNumThreadsProperty()
	{
		final String old = System.getProperty( Threads.numThreadsProperty );

		try
		{
			System.setProperty( Threads.numThreadsProperty, "5" );
			assertEquals( 5, Threads.numThreads() );

			System.setProperty( Threads.numThreadsProperty, "many" );
			assertEquals( Math.max( 1, Runtime.getRuntime().availableProcessors() ), Threads.numThreads() );
		}
		finally
		{
			if ( old == null )
				System.clearProperty( Threads.numThreadsProperty );
			else
				System.setProperty( Threads.numThreadsProperty, old );
		}
	}
}
