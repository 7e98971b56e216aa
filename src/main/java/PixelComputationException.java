/*
 **
 ** PixelComputationException.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  PixelComputationException.java is free software: you can redistribute it and/or modify
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
 * Numerical failure confined to the time series of a single pixel. The scheduler fills
 * such a pixel with the sentinel and keeps going.
 */
public class PixelComputationException extends RuntimeException {
	private static final long serialVersionUID = -6270953417160588132L;
	private int pixelX=-1;
	private int pixelY=-1;

	public PixelComputationException(String message) {
		super(message);
	}

	public PixelComputationException(String message, Throwable cause) {
		super(message, cause);
	}

	public PixelComputationException atPixel(int x, int y) {
		this.pixelX=x;
		this.pixelY=y;
		return this;
	}

	public int getPixelX() { return this.pixelX; }
	public int getPixelY() { return this.pixelY; }

	@Override
	public String getMessage() {
		if (this.pixelX<0) return super.getMessage();
		return "pixel ("+this.pixelX+","+this.pixelY+"): "+super.getMessage();
	}
}
