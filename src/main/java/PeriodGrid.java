/*
 **
 ** PeriodGrid.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  PeriodGrid.java is free software: you can redistribute it and/or modify
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
import java.util.Arrays;

/**
 * Strictly increasing periods scanned by the wavelet transform, from tMin to tMax inclusive.
 * Log spacing gives the same relative resolution at every period.
 */
public class PeriodGrid {
	private final double [] periods;

	public PeriodGrid(double tMin, double tMax, int nT, WaveletParameters.PeriodSpacing spacing){
		if (!(tMin>0) || !(tMin<tMax))
			throw new WaveletParameterException("tMin", "period range must satisfy 0 < tMin < tMax, got "+tMin+".."+tMax);
		if (nT<1) throw new WaveletParameterException("nT", "need at least one period, got "+nT);
		this.periods=new double[nT];
		if (nT==1) {
			this.periods[0]=tMin;
			return;
		}
		if (spacing==WaveletParameters.PeriodSpacing.LINEAR){
			double step=(tMax-tMin)/(nT-1);
			for (int i=0;i<nT;i++) this.periods[i]=tMin+i*step;
		} else {
			double logMin=Math.log(tMin);
			double step=(Math.log(tMax)-logMin)/(nT-1);
			for (int i=0;i<nT;i++) this.periods[i]=Math.exp(logMin+i*step);
		}
		// exact end points
		this.periods[0]=tMin;
		this.periods[nT-1]=tMax;
	}

	public PeriodGrid(WaveletParameters wp){
		this(wp.tMin, wp.tMax, wp.nT, wp.periodSpacing);
	}

	public int size(){
		return this.periods.length;
	}

	public double getPeriod(int index){
		return this.periods[index];
	}

	public double [] getPeriods(){
		return this.periods.clone();
	}

	/** Index of the grid period closest to the specified one */
	public int nearestIndex(double period){
		int i=Arrays.binarySearch(this.periods, period);
		if (i>=0) return i;
		int above=-i-1;
		if (above==0) return 0;
		if (above>=this.periods.length) return this.periods.length-1;
		return ((period-this.periods[above-1]) <= (this.periods[above]-period))? (above-1) : above;
	}

	@Override
	public String toString(){
		return "PeriodGrid["+this.periods.length+" periods, "+this.periods[0]+".."+this.periods[this.periods.length-1]+"]";
	}
}
