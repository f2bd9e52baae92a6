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

/**
 * Thrown when a node set cannot be processed, e.g. nothing survives resizing
 * or a density estimate is requested for an empty node set.
 */
public class DegenerateInputException extends IllegalArgumentException
{
	private static final long serialVersionUID = 6640815263981946177L;

	public DegenerateInputException( final String message )
	{
		super( message );
	}
}
