/*
 **
 ** DoubleGaussianBlur.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  DoubleGaussianBlur.java is free software: you can redistribute it and/or modify
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
 * Separable Gaussian smoothing of single frames, double precision version of the ImageJ
 * GaussianBlur filter (M. Schmid). Out-of-frame pixels take the value of the nearest
 * edge pixel. Lines are downscaled before convolving when sigma is large and upscaled
 * back afterwards.
 */
public class DoubleGaussianBlur {
	public static final double DEFAULT_ACCURACY=0.002; // kernel cut-off for float data
	private static final int    UPSCALE_K_RADIUS=2;     // extra (downscaled) points needed for upscaling
	private static final double MIN_DOWNSCALED_SIGMA=4.;// minimal sigma in the downscaled line

	private final double accuracy;

	public DoubleGaussianBlur() {
		this(DEFAULT_ACCURACY);
	}

	public DoubleGaussianBlur(double accuracy) {
		this.accuracy=accuracy;
	}

	/**
	 * Smooths a frame spatially and returns the result, the input frame is not modified
	 * @param frame  row-scan pixels
	 * @param width  frame width
	 * @param height frame height
	 * @param sigma  standard deviation of the Gaussian, in pixels, same for both directions
	 * @return new smoothed frame
	 */
	public float [] blurFrame(float [] frame, int width, int height, double sigma){
		double [] pixels=new double[frame.length];
		for (int i=0;i<pixels.length;i++) pixels[i]=frame[i];
		blurDouble(pixels, width, height, sigma, sigma);
		float [] result=new float[pixels.length];
		for (int i=0;i<pixels.length;i++) result[i]=(float) pixels[i];
		return result;
	}

	/** Smooths pixels in place, sigma&lt;=0 skips that direction */
	public void blurDouble(double[] pixels, int width, int height, double sigmaX, double sigmaY) {
		if (sigmaX > 0) blurLines(pixels, width, height, sigmaX, true);
		if (sigmaY > 0) blurLines(pixels, width, height, sigmaY, false);
	}

	/**
	 * Blurs all rows (xDirection) or all columns of the frame in place
	 * @param pixels     frame pixels
	 * @param sigma      standard deviation of the Gaussian
	 * @param xDirection true - rows, false - columns
	 */
	void blurLines(double [] pixels, int width, int height, double sigma, boolean xDirection) {
		int length =    xDirection ? width : height; // points per line
		int pointInc =  xDirection ? 1 : width;      // pixel index increment along the line
		int lineInc =   xDirection ? width : 1;      // pixel index increment to the next line
		int numLines =  xDirection ? height : width;
		if (sigma > 2*MIN_DOWNSCALED_SIGMA + 0.5) {
			int reduceBy = (int) Math.floor(sigma/MIN_DOWNSCALED_SIGMA);
			if (reduceBy > length) reduceBy = length;
			// downscaling adds variance 1/3, upscaling 1/4 (in downscaled pixels)
			double sigmaGauss = Math.sqrt(sigma*sigma/(reduceBy*reduceBy) - 1./3. - 1./4.);
			int maxLength = (length+reduceBy-1)/reduceBy + 2*(UPSCALE_K_RADIUS + 1);
			double[][] gaussKernel = makeGaussianKernel(sigmaGauss, maxLength);
			int newLength = (length+reduceBy-1)/reduceBy + 2*(UPSCALE_K_RADIUS + 1);
			int unscaled0 = -(UPSCALE_K_RADIUS + 1)*reduceBy; // input point at cache index 0
			double[] downscaleKernel = makeDownscaleKernel(reduceBy);
			double[] upscaleKernel =   makeUpscaleKernel(reduceBy);
			double[] downscaled = new double[newLength];
			double[] convolved =  new double[newLength];
			for (int line=0, pixel0=0; line<numLines; line++, pixel0+=lineInc) {
				downscaleLine(pixels, downscaled, downscaleKernel, reduceBy, pixel0, unscaled0, length, pointInc, newLength);
				convolveLine(downscaled, convolved, gaussKernel, 1, newLength-1, 0, 1);
				upscaleLine(convolved, pixels, upscaleKernel, reduceBy, pixel0, unscaled0, length, pointInc);
			}
		} else {
			double[][] gaussKernel = makeGaussianKernel(sigma, length);
			double[] line = new double[length];
			for (int nLine=0, pixel0=0; nLine<numLines; nLine++, pixel0+=lineInc) {
				for (int i=0, p=pixel0; i<length; i++, p+=pointInc) line[i] = pixels[p];
				convolveLine(line, pixels, gaussKernel, 0, length, pixel0, pointInc);
			}
		}
	}

	/**
	 * One-sided normalized Gaussian kernel and the running sum over its tail.
	 * Near-edge values are replaced by a parabola reaching 0 at the first out-of-kernel
	 * point, so the kernel has a continuous first derivative.
	 * @param sigma     standard deviation in pixels
	 * @param maxRadius limit for the kernel radius (line length), not less than 50 is used
	 * @return [0][i] - kernel value at distance i, [1][i] - sum of all kernel values beyond i
	 */
	public double[][] makeGaussianKernel(double sigma, int maxRadius) {
		int kRadius = (int) Math.ceil(sigma*Math.sqrt(-2*Math.log(this.accuracy)))+1;
		if (maxRadius < 50) maxRadius = 50;
		if (kRadius > maxRadius) kRadius = maxRadius;
		double[][] kernel = new double[2][kRadius];
		for (int i=0; i<kRadius; i++) kernel[0][i] = Math.exp(-0.5*i*i/sigma/sigma);
		if (kRadius < maxRadius && kRadius > 3) { // smooth the cut-off
			double sqrtSlope = Double.MAX_VALUE;
			int r = kRadius;
			while (r > kRadius/2) {
				r--;
				double a = Math.sqrt(kernel[0][r])/(kRadius-r);
				if (a < sqrtSlope) sqrtSlope = a;
				else break;
			}
			for (int r1 = r+2; r1 < kRadius; r1++)
				kernel[0][r1] = (kRadius-r1)*(kRadius-r1)*sqrtSlope*sqrtSlope;
		}
		double sum;
		if (kRadius < maxRadius) {
			sum = kernel[0][0];
			for (int i=1; i<kRadius; i++) sum += 2*kernel[0][i];
		} else {
			sum = sigma * Math.sqrt(2*Math.PI);
		}
		double rsum = 0.5 + 0.5*kernel[0][0]/sum;
		for (int i=0; i<kRadius; i++) {
			double v = kernel[0][i]/sum;
			kernel[0][i] = v;
			rsum -= v;
			kernel[1][i] = rsum;
		}
		return kernel;
	}

	/* Downscales a line by reduceBy into cache; line point unscaled0 maps to cache[0] */
	void downscaleLine(double[] pixels, double[] cache, double[] kernel,
			int reduceBy, int pixel0, int unscaled0, int length, int pointInc, int newLength) {
		double first = pixels[pixel0];
		double last = pixels[pixel0 + pointInc*(length-1)];
		int xin = unscaled0 - reduceBy/2;
		int p = pixel0 + pointInc*xin;
		for (int xout=0; xout<newLength; xout++) {
			double v = 0;
			for (int x=0; x<reduceBy; x++, xin++, p+=pointInc) {
				v += kernel[x] *            ((xin-reduceBy < 0) ? first : ((xin-reduceBy >= length) ? last : pixels[p-pointInc*reduceBy]));
				v += kernel[x+reduceBy] *   ((xin < 0) ? first : ((xin >= length) ? last : pixels[p]));
				v += kernel[x+2*reduceBy] * ((xin+reduceBy < 0) ? first : ((xin+reduceBy >= length) ? last : pixels[p+pointInc*reduceBy]));
			}
			cache[xout] = v;
		}
	}

	/* Downscaling kernel, runs from -1.5 to 1.5 downscaled pixels, preserves norm and position */
	double[] makeDownscaleKernel (int unitLength) {
		int mid = unitLength*3/2;
		double[] kernel = new double[3*unitLength];
		for (int i=0; i<=unitLength/2; i++) {
			double x = i/(double) unitLength;
			double v = (0.75-x*x)/unitLength;
			kernel[mid-i] = v;
			kernel[mid+i] = v;
		}
		for (int i=unitLength/2+1; i<(unitLength*3+1)/2; i++) {
			double x = i/(double) unitLength;
			double v = (0.125 + 0.5*(x-1)*(x-2))/unitLength;
			kernel[mid-i] = v;
			kernel[mid+i] = v;
		}
		return kernel;
	}

	/* Upscales cache back into the line of the frame */
	void upscaleLine (double[] cache, double[] pixels, double[] kernel,
			int reduceBy, int pixel0, int unscaled0, int length, int pointInc) {
		int p = pixel0;
		for (int xout = 0; xout < length; xout++, p+=pointInc) {
			int xin = (xout-unscaled0+reduceBy-1)/reduceBy;
			int x = reduceBy - 1 - (xout-unscaled0+reduceBy-1)%reduceBy;
			pixels[p] = cache[xin-2]*kernel[x]
					+ cache[xin-1]*kernel[x+reduceBy]
					+ cache[xin]*kernel[x+2*reduceBy]
					+ cache[xin+1]*kernel[x+3*reduceBy];
		}
	}

	/* Upscaling kernel: four convolved unit squares, from -2 to 2 downscaled pixels */
	double[] makeUpscaleKernel (int unitLength) {
		double[] kernel = new double[4*unitLength];
		int mid = 2*unitLength;
		kernel[0] = 0;
		for (int i=0; i<unitLength; i++) {
			double x = i/(double) unitLength;
			double v = 2./3. -x*x*(1-0.5*x);
			kernel[mid+i] = v;
			kernel[mid-i] = v;
		}
		for (int i=unitLength; i<2*unitLength; i++) {
			double x = i/(double) unitLength;
			double v = (2.-x)*(2.-x)*(2.-x)/6.;
			kernel[mid+i] = v;
			kernel[mid-i] = v;
		}
		return kernel;
	}

	/**
	 * Convolves a line with a symmetric one-sided kernel, writing points writeFrom..writeTo-1
	 * to pixels starting at point0 with step pointInc. Points outside the line are
	 * replaced by the edge values using the running kernel sums.
	 */
	public void convolveLine(double[] input, double[] pixels, double[][] kernel,
			int writeFrom, int writeTo, int point0, int pointInc) {
		int length = input.length;
		double first = input[0];
		double last = input[length-1];
		double[] kern = kernel[0];
		double kern0 = kern[0];
		double[] kernSum = kernel[1];
		int kRadius = kern.length;
		int firstPart = kRadius < length ? kRadius : length;
		int p = point0 + writeFrom*pointInc;
		int i = writeFrom;
		for (; i<firstPart; i++,p+=pointInc) { // window reaches below 0
			double result = input[i]*kern0;
			result += kernSum[i]*first;
			if (i+kRadius>length) result += kernSum[length-i-1]*last;
			for (int k=1; k<kRadius; k++) {
				double v = 0;
				if (i-k >= 0) v += input[i-k];
				if (i+k<length) v+= input[i+k];
				result += kern[k] * v;
			}
			pixels[p] = result;
		}
		int iEndInside = length-kRadius<writeTo ? length-kRadius : writeTo;
		for (;i<iEndInside;i++,p+=pointInc) {
			double result = input[i]*kern0;
			for (int k=1; k<kRadius; k++)
				result += kern[k] * (input[i-k] + input[i+k]);
			pixels[p] = result;
		}
		for (; i<writeTo; i++,p+=pointInc) { // window reaches beyond the end
			double result = input[i]*kern0;
			if (i<kRadius) result += kernSum[i]*first;
			if (i+kRadius>=length) result += kernSum[length-i-1]*last;
			for (int k=1; k<kRadius; k++) {
				double v = 0;
				if (i-k >= 0) v += input[i-k];
				if (i+k<length) v+= input[i+k];
				result += kern[k] * v;
			}
			pixels[p] = result;
		}
	}
}
