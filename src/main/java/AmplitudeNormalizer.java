/*
 **
 ** AmplitudeNormalizer.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  AmplitudeNormalizer.java is free software: you can redistribute it and/or modify
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
 * Divides an amplitude series by its sliding window envelope so amplitudes become of
 * order 1 even when the oscillation strength drifts.
 * <p>
 * The window is centered and odd: n=round(windowSize/dt) samples give a half width of
 * n/2 (integer division), so an even n is widened by one sample. Closer to an end than
 * half a window, the window shrinks on both sides to the distance to that end, so it
 * stays centered (the first and last samples are divided by themselves).
 */
public class AmplitudeNormalizer {
	private final double windowSize;
	private final int halfWidth;
	private final WaveletParameters.EnvelopeMethod method;

	/**
	 * @param windowSize window in time units, NaN disables normalization
	 * @param dt         sampling interval
	 * @param method     envelope estimate
	 */
	public AmplitudeNormalizer(double windowSize, double dt, WaveletParameters.EnvelopeMethod method){
		this.windowSize=windowSize;
		this.method=method;
		if (WaveletParameters.isSet(windowSize)) {
			int samples=(int) Math.round(windowSize/dt);
			if (samples<1) samples=1;
			this.halfWidth=samples/2;
		} else {
			this.halfWidth=-1;
		}
	}

	public boolean isEnabled(){
		return this.halfWidth>=0;
	}

	public double getWindowSize(){
		return this.windowSize;
	}

	public int getHalfWidth(){
		return this.halfWidth;
	}

	/** Envelope at each sample */
	public double [] envelope(double [] amplitude){
		int n=amplitude.length;
		double [] envelope=new double[n];
		if (this.method==WaveletParameters.EnvelopeMethod.MAX){
			for (int t=0;t<n;t++){
				int h=halfWidthAt(t, n);
				double max=0.0;
				for (int j=t-h;j<=t+h;j++) if (amplitude[j]>max) max=amplitude[j];
				envelope[t]=max;
			}
		} else {
			double [] cumSq=new double[n+1]; // cumSq[i] - sum of squares of the first i samples
			for (int t=0;t<n;t++) cumSq[t+1]=cumSq[t]+amplitude[t]*amplitude[t];
			for (int t=0;t<n;t++){
				int h=halfWidthAt(t, n);
				double sumSq=cumSq[t+h+1]-cumSq[t-h];
				envelope[t]=Math.sqrt(Math.max(sumSq, 0.0)/(2*h+1));
			}
		}
		return envelope;
	}

	private int halfWidthAt(int t, int n){
		return Math.min(this.halfWidth, Math.min(t, n-1-t));
	}

	/**
	 * Normalized amplitude, zero where the envelope vanishes. When normalization is
	 * disabled the argument itself is returned.
	 */
	public double [] normalize(double [] amplitude){
		if (!isEnabled()) return amplitude;
		double [] envelope=envelope(amplitude);
		double [] normalized=new double[amplitude.length];
		for (int t=0;t<amplitude.length;t++)
			normalized[t]=(envelope[t]>0.0)? (amplitude[t]/envelope[t]) : 0.0;
		return normalized;
	}
}
