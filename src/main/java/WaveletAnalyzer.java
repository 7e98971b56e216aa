/*
 **
 ** WaveletAnalyzer.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  WaveletAnalyzer.java is free software: you can redistribute it and/or modify
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
 * Continuous wavelet transform of single time series over the period grid and extraction
 * of the ridge. The ridge is the per-time-point maximum of the wavelet power over all
 * periods, no continuity between neighboring time points is imposed; on equal power the
 * shorter period wins.
 * <p>
 * The series mean is subtracted and the series is zero-padded to a power of 2 before the
 * transform. Power is |W|^2 divided by the series variance, so white noise has an expected
 * power of 1.
 * <p>
 * One instance per thread: the filter bank may be shared, the FHT and the work arrays may not.
 */
public class WaveletAnalyzer {
	/** Variance below this fraction of the squared mean is treated as a constant series */
	public static final double FLAT_VARIANCE_FRACTION=1E-24;

	private final MorletFilterBank filterBank;
	private final int length;
	private final DoubleFHT fht=new DoubleFHT();
	private final double [] padded;
	private final double [] re;
	private final double [] im;
	private final double [] bestPower;
	private final double [] bestRe;
	private final double [] bestIm;
	private final int    [] bestIndex;

	/**
	 * @param filterBank wavelets, built for DoubleFHT.paddedSize(length)
	 * @param length     number of samples in the series to analyze
	 */
	public WaveletAnalyzer(MorletFilterBank filterBank, int length){
		if (filterBank.getSize()<length)
			throw new IllegalArgumentException("Filter bank size "+filterBank.getSize()+" is shorter than the series ("+length+")");
		this.filterBank=filterBank;
		this.length=length;
		this.padded=   new double[filterBank.getSize()];
		this.re=       new double[length];
		this.im=       new double[length];
		this.bestPower=new double[length];
		this.bestRe=   new double[length];
		this.bestIm=   new double[length];
		this.bestIndex=new int   [length];
	}

	/** Filter bank matching the series length */
	public static MorletFilterBank createFilterBank(PeriodGrid periodGrid, double dt, int length){
		return new MorletFilterBank(periodGrid, dt, DoubleFHT.paddedSize(length));
	}

	public MorletFilterBank getFilterBank(){
		return this.filterBank;
	}

	/**
	 * Transforms the series and extracts the ridge
	 * @param series time series, length as specified in the constructor
	 * @return ridge with the un-normalized amplitude
	 * @throws PixelComputationException if the series or the transform has non-finite values
	 */
	public RidgeResult analyze(double [] series){
		if (series.length!=this.length)
			throw new IllegalArgumentException("Analyzer was built for series of "+this.length+" samples, got "+series.length);
		double sum=0.0;
		for (int t=0;t<this.length;t++){
			if (!isFinite(series[t])) throw new PixelComputationException("non-finite sample "+series[t]+" at t="+t);
			sum+=series[t];
		}
		double mean=sum/this.length;
		double variance=0.0;
		for (int t=0;t<this.length;t++) variance+=(series[t]-mean)*(series[t]-mean);
		variance/=this.length;
		if ((variance==0.0) || (variance<=FLAT_VARIANCE_FRACTION*mean*mean)) return RidgeResult.flat(this.length);

		for (int t=0;t<this.length;t++) this.padded[t]=series[t]-mean;
		for (int t=this.length;t<this.padded.length;t++) this.padded[t]=0.0;
		this.fht.transform(this.padded);

		for (int t=0;t<this.length;t++) {
			this.bestPower[t]=-1.0;
			this.bestIndex[t]=0;
		}
		for (int i=0;i<this.filterBank.getNumScales();i++){
			this.fht.analyticFilter(this.padded, this.filterBank.getFilter(i), this.re, this.im);
			for (int t=0;t<this.length;t++){
				double p=this.re[t]*this.re[t]+this.im[t]*this.im[t];
				if (p>this.bestPower[t]){ // strict, ties keep the shorter period
					this.bestPower[t]=p;
					this.bestIndex[t]=i;
					this.bestRe[t]=this.re[t];
					this.bestIm[t]=this.im[t];
				}
			}
		}

		PeriodGrid periodGrid=this.filterBank.getPeriodGrid();
		RidgeResult rr=new RidgeResult(this.length);
		for (int t=0;t<this.length;t++){
			double p=this.bestPower[t];
			if (!isFinite(p) || (p<0.0)) throw new PixelComputationException("wavelet power "+p+" at t="+t);
			int index=this.bestIndex[t];
			rr.phase[t]=    RidgeResult.wrapPhase(Math.atan2(this.bestIm[t], this.bestRe[t]));
			rr.period[t]=   periodGrid.getPeriod(index);
			rr.power[t]=    p/variance;
			rr.amplitude[t]=this.filterBank.modulusToAmplitude(Math.sqrt(p), index);
		}
		return rr;
	}

	private static boolean isFinite(double d){
		return !Double.isNaN(d) && !Double.isInfinite(d);
	}
}
