/*
 **
 ** SincDetrender.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  SincDetrender.java is free software: you can redistribute it and/or modify
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
 * Removes slow trends from pixel time series: the trend is the series low-pass filtered
 * with a Blackman-windowed sinc kernel of cut-off period tCutoff, and is subtracted
 * from the series.
 * <p>
 * The kernel is as long as possible (largest odd length not exceeding the series) for
 * the sharpest roll-off, and has unit DC gain. Before filtering the series is extended by
 * half the kernel length on each side by mirroring around the end samples (the end sample
 * itself is not repeated).
 */
public class SincDetrender {
	private final double tCutoff;
	private final double dt;
	private final int length;
	private final double [] kernel; // null when disabled

	/**
	 * @param tCutoff cut-off period, NaN disables detrending
	 * @param dt      sampling interval
	 * @param length  length of the series that will be filtered
	 */
	public SincDetrender(double tCutoff, double dt, int length){
		this.tCutoff=tCutoff;
		this.dt=dt;
		this.length=length;
		this.kernel=WaveletParameters.isSet(tCutoff)? makeKernel(tCutoff, dt, length) : null;
	}

	public boolean isEnabled(){
		return this.kernel!=null;
	}

	public double getCutoff(){
		return this.tCutoff;
	}

	public double [] getKernel(){
		return (this.kernel==null)? null : this.kernel.clone();
	}

	static double [] makeKernel(double tCutoff, double dt, int length){
		int m=((length & 1)==1)? length : (length-1);
		if (m<1) m=1;
		double fc=dt/tCutoff; // cut-off frequency, cycles per sample
		double center=0.5*(m-1);
		double [] kernel=new double[m];
		double sum=0.0;
		for (int n=0;n<m;n++){
			double window=1.0;
			if (m>1) window=0.42-0.5*Math.cos(2*Math.PI*n/(m-1))+0.08*Math.cos(4*Math.PI*n/(m-1));
			kernel[n]=sinc(2*fc*(n-center))*window;
			sum+=kernel[n];
		}
		if (!(Math.abs(sum)>0))
			throw new WaveletParameterException("tCutoff", "sinc filter for cut-off period "+tCutoff+" has no DC response");
		for (int n=0;n<m;n++) kernel[n]/=sum;
		return kernel;
	}

	static double sinc(double x){
		if (x==0.0) return 1.0;
		double px=Math.PI*x;
		return Math.sin(px)/px;
	}

	/** Low-pass filtered series */
	public double [] trend(double [] series){
		if (series.length!=this.length)
			throw new IllegalArgumentException("Detrender was built for series of "+this.length+" samples, got "+series.length);
		double [] trend=new double[series.length];
		if (this.kernel==null) return trend;
		int m=this.kernel.length;
		int half=(m-1)/2;
		int last=series.length-1;
		for (int t=0;t<series.length;t++){
			double s=0.0;
			for (int k=0;k<m;k++){
				int j=t+k-half;
				if (j<0) j=-j;
				else if (j>last) j=2*last-j;
				s+=this.kernel[k]*series[j];
			}
			trend[t]=s;
		}
		return trend;
	}

	/**
	 * Series with the trend removed. When detrending is disabled the argument itself is
	 * returned.
	 */
	public double [] detrend(double [] series){
		if (this.kernel==null) return series;
		double [] trend=trend(series);
		double [] detrended=new double[series.length];
		for (int t=0;t<series.length;t++) detrended[t]=series[t]-trend[t];
		return detrended;
	}
}
