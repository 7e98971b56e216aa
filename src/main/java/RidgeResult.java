/*
 **
 ** RidgeResult.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  RidgeResult.java is free software: you can redistribute it and/or modify
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
 * Wavelet ridge of one pixel: phase, period, power and amplitude of the strongest
 * component at each time point.
 */
public class RidgeResult {
	public static final double SENTINEL=Double.NaN;

	public final double [] phase;     // radians, (-pi, pi]
	public final double [] period;    // same units as dt
	public final double [] power;     // normalized wavelet power
	public double [] amplitude;       // replaced by the normalized amplitude

	public RidgeResult(int length){
		this.phase=    new double[length];
		this.period=   new double[length];
		this.power=    new double[length];
		this.amplitude=new double[length];
	}

	public int length(){
		return this.phase.length;
	}

	/**
	 * Result for a series without any oscillation: no power and no amplitude, phase and
	 * period are undefined.
	 */
	public static RidgeResult flat(int length){
		RidgeResult rr=new RidgeResult(length);
		for (int t=0;t<length;t++){
			rr.phase[t]=SENTINEL;
			rr.period[t]=SENTINEL;
		}
		return rr;
	}

	public static boolean isSentinel(double value){
		return Double.isNaN(value);
	}

	/** Wraps an angle to (-pi, pi] */
	public static double wrapPhase(double angle){
		double a=Math.IEEEremainder(angle, 2*Math.PI); // [-pi, pi]
		if (a<=-Math.PI) a+=2*Math.PI;
		return a;
	}
}
