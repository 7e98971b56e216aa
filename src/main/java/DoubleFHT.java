/*
 **
 ** DoubleFHT.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  DoubleFHT.java is free software: you can redistribute it and/or modify
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
 * One-dimensional Fast Hartley Transform on double arrays (radix-4 first stage, after the
 * ImageJ FHT class) and frequency-domain filtering of real series with analytic filters.
 * Sine/cosine and bit reversal tables are cached per transform size. Not thread safe,
 * each worker thread uses its own instance.
 */
public class DoubleFHT {
	public static final int MIN_SIZE=4;
	public static final int MAX_LOG2=24;

	private final double [][] cCache=  new double[MAX_LOG2+1][];
	private final double [][] sCache=  new double[MAX_LOG2+1][];
	private final int [][] bitrevCache=new int   [MAX_LOG2+1][];
	private double[] C;
	private double[] S;
	private int[] bitrev;
	private double[] tempArr;
	private double[] filteredRe; // work arrays for analyticFilter()
	private double[] filteredIm;
	private int maxN=-1;

	/** Smallest power of 2 that is not less than n (and not less than MIN_SIZE) */
	public static int paddedSize(int n){
		int size=MIN_SIZE;
		while (size<n) size <<= 1;
		return size;
	}

	public static boolean isPowerOf2(int n){
		return (n>=MIN_SIZE) && ((n & (n-1))==0);
	}

	/** Forward transform in place, data length should be a power of 2 */
	public void transform(double [] data) {
		transform(data, false);
	}

	/** Inverse transform in place (forward transform divided by the length) */
	public void inverseTransform(double [] data) {
		transform(data, true);
	}

	public void transform(double [] data, boolean inverse) {
		updateMaxN(data.length);
		dfht3(data, inverse, this.maxN);
	}

	private void updateMaxN(int n){
		if (n==this.maxN) return;
		if (!isPowerOf2(n))
			throw new IllegalArgumentException("FHT length should be a power of 2 and at least "+MIN_SIZE+", got "+n);
		int ln2=log2(n);
		if (ln2>MAX_LOG2)
			throw new IllegalArgumentException("FHT length "+n+" exceeds 2^"+MAX_LOG2);
		if (this.cCache[ln2]==null){
			makeSinCosTables(n, ln2);
			this.bitrevCache[ln2]=makeBitReverseTable(n);
		}
		this.C=this.cCache[ln2];
		this.S=this.sCache[ln2];
		this.bitrev=this.bitrevCache[ln2];
		this.tempArr=new double[n];
		this.filteredRe=new double[n];
		this.filteredIm=new double[n];
		this.maxN=n;
	}

	/**
	 * Filters a real series with a filter defined in the frequency domain and returns the
	 * complex result. The filter is real and should vanish at zero and negative frequencies
	 * (indices above size/2), then the result is the analytic (one-sided) response.
	 * @param fht    forward FHT of the zero-padded series, not modified
	 * @param filter filter response for each FFT bin, same length as fht
	 * @param re     receives real part of the first re.length points of the filtered series
	 * @param im     receives imaginary part, same length as re
	 */
	public void analyticFilter(double [] fht, double [] filter, double [] re, double [] im){
		int n=fht.length;
		updateMaxN(n);
		double [] a=this.filteredRe;
		double [] b=this.filteredIm;
		// FFT(k) = (H(k)+H(-k))/2 - i*(H(k)-H(-k))/2, multiplied by the filter
		for (int k=0;k<n;k++){
			double f=filter[k];
			if (f==0.0){
				a[k]=0.0;
				b[k]=0.0;
				continue;
			}
			int mk=(n-k)%n;
			a[k]=  0.5*f*(fht[k]+fht[mk]);
			b[k]= -0.5*f*(fht[k]-fht[mk]);
		}
		dfht3(a, true, n);
		dfht3(b, true, n);
		// complex inverse FFT from the two real inverse FHTs
		for (int t=0;t<re.length;t++){
			int mt=(n-t)%n;
			re[t]=0.5*((a[t]+a[mt])-(b[t]-b[mt]));
			im[t]=0.5*((a[t]-a[mt])+(b[t]+b[mt]));
		}
	}

	private void makeSinCosTables(int maxN, int ln2) {
		int n = maxN/4;
		double [] c = new double[n];
		double [] s = new double[n];
		double theta = 0.0;
		double dTheta = 2.0 * Math.PI/maxN;
		for (int i=0; i<n; i++) {
			c[i] = Math.cos(theta);
			s[i] = Math.sin(theta);
			theta += dTheta;
		}
		this.cCache[ln2]=c;
		this.sCache[ln2]=s;
	}

	private int [] makeBitReverseTable(int maxN) {
		int [] table = new int[maxN];
		int nLog2 = log2(maxN);
		for (int i=0; i<maxN; i++) table[i] = bitRevX(i, nLog2);
		return table;
	}

	/** Optimized 1D FHT of the first maxN elements of x */
	void dfht3 (double[] x, boolean inverse, int maxN) {
		int stage, gpNum, gpSize, numGps, nLog2;
		int bfNum, numBfs;
		int ad0, ad1, ad2, ad3, ad4, csAd;
		double rt1, rt2, rt3, rt4;

		nLog2 = log2(maxN);
		bitReverse(x, maxN);
		gpSize = 2;     // first & second stages - radix 4 butterflies
		numGps = maxN / 4;
		for (gpNum=0; gpNum<numGps; gpNum++)  {
			ad1 = gpNum * 4;
			ad2 = ad1 + 1;
			ad3 = ad1 + gpSize;
			ad4 = ad2 + gpSize;
			rt1 = x[ad1] + x[ad2];   // a + b
			rt2 = x[ad1] - x[ad2];   // a - b
			rt3 = x[ad3] + x[ad4];   // c + d
			rt4 = x[ad3] - x[ad4];   // c - d
			x[ad1] = rt1 + rt3;      // a + b + (c + d)
			x[ad2] = rt2 + rt4;      // a - b + (c - d)
			x[ad3] = rt1 - rt3;      // a + b - (c + d)
			x[ad4] = rt2 - rt4;      // a - b - (c - d)
		}
		if (nLog2 > 2) {
			gpSize = 4;
			numBfs = 2;
			numGps = numGps / 2;
			for (stage=2; stage<nLog2; stage++) {
				for (gpNum=0; gpNum<numGps; gpNum++) {
					ad0 = gpNum * gpSize * 2;
					ad1 = ad0;     // first butterfly needs no multiplications
					ad2 = ad1 + gpSize;
					ad3 = ad1 + gpSize / 2;
					ad4 = ad3 + gpSize;
					rt1 = x[ad1];
					x[ad1] = x[ad1] + x[ad2];
					x[ad2] = rt1 - x[ad2];
					rt1 = x[ad3];
					x[ad3] = x[ad3] + x[ad4];
					x[ad4] = rt1 - x[ad4];
					for (bfNum=1; bfNum<numBfs; bfNum++) {
						ad1 = bfNum + ad0;
						ad2 = ad1 + gpSize;
						ad3 = gpSize - bfNum + ad0;
						ad4 = ad3 + gpSize;
						csAd = bfNum * numGps;
						rt1 = x[ad2] * this.C[csAd] + x[ad4] * this.S[csAd];
						rt2 = x[ad4] * this.C[csAd] - x[ad2] * this.S[csAd];
						x[ad2] = x[ad1] - rt1;
						x[ad1] = x[ad1] + rt1;
						x[ad4] = x[ad3] + rt2;
						x[ad3] = x[ad3] - rt2;
					}
				}
				gpSize *= 2;
				numBfs *= 2;
				numGps = numGps / 2;
			}
		}
		if (inverse)  {
			for (int i=0; i<maxN; i++) x[i] = x[i] / maxN;
		}
	}

	static int log2 (int x) {
		return 31-Integer.numberOfLeadingZeros(x);
	}

	private void bitReverse(double[] x, int maxN) {
		for (int i=0; i<maxN; i++) this.tempArr[i] = x[this.bitrev[i]];
		System.arraycopy(this.tempArr, 0, x, 0, maxN);
	}

	private static int bitRevX (int  x, int bitlen) {
		int  temp = 0;
		for (int i=0; i<bitlen; i++)
			if ((x & (1<<i)) !=0) temp  |= (1<<(bitlen-i-1));
		return temp;
	}
}
