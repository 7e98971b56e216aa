/*
 **
 ** WaveletParameterException.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  WaveletParameterException.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

/**
 * Invalid or contradictory wavelet processing parameters. Thrown before any pixel is
 * processed, names the offending parameter.
 */
public class WaveletParameterException extends IllegalArgumentException {
	private static final long serialVersionUID = 2814071566532190017L;
	private final String parameterName;

	public WaveletParameterException(String parameterName, String message) {
		super(parameterName+": "+message);
		this.parameterName=parameterName;
	}

	public String getParameterName() {
		return this.parameterName;
	}
}
