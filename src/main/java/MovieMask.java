/*
 **
 ** MovieMask.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  MovieMask.java is free software: you can redistribute it and/or modify
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
 * Pixel validity for a movie. A fixed mask holds one frame-sized mask used for every time
 * point, a dynamic mask holds one mask per frame. true means valid.
 */
public class MovieMask {
	private final int width;
	private final int height;
	private final int numFrames;
	private final boolean [] fixedMask;      // null unless fixed
	private final boolean [][] dynamicMask;  // [t][pixel], null unless dynamic

	private MovieMask(int width, int height, int numFrames, boolean [] fixedMask, boolean [][] dynamicMask){
		this.width=width;
		this.height=height;
		this.numFrames=numFrames;
		this.fixedMask=fixedMask;
		this.dynamicMask=dynamicMask;
	}

	/** All pixels valid at all times */
	public static MovieMask allValid(int width, int height, int numFrames){
		return new MovieMask(width, height, numFrames, null, null);
	}

	public static MovieMask fixed(boolean [] mask, int width, int height, int numFrames){
		if (mask.length!=width*height)
			throw new IllegalArgumentException("Mask has "+mask.length+" pixels, movie frames have "+(width*height));
		return new MovieMask(width, height, numFrames, mask, null);
	}

	public static MovieMask dynamic(boolean [][] masks, int width, int height){
		for (int t=0;t<masks.length;t++) if (masks[t].length!=width*height)
			throw new IllegalArgumentException("Mask for frame "+t+" has "+masks[t].length+" pixels, movie frames have "+(width*height));
		return new MovieMask(width, height, masks.length, null, masks);
	}

	/** Thresholds a single frame, the result applies to every frame of the movie */
	public static MovieMask thresholdFrame(Movie movie, int frame, double threshold){
		return fixed(threshold(movie.getFrame(frame), threshold), movie.getWidth(), movie.getHeight(), movie.getNumFrames());
	}

	/** Thresholds each frame independently */
	public static MovieMask thresholdEachFrame(Movie movie, double threshold){
		boolean [][] masks=new boolean[movie.getNumFrames()][];
		for (int t=0;t<masks.length;t++) masks[t]=threshold(movie.getFrame(t), threshold);
		return dynamic(masks, movie.getWidth(), movie.getHeight());
	}

	static boolean [] threshold(float [] frame, double threshold){
		boolean [] mask=new boolean[frame.length];
		for (int i=0;i<frame.length;i++) mask[i]= frame[i]>=threshold;
		return mask;
	}

	public int getWidth()     { return this.width; }
	public int getHeight()    { return this.height; }
	public int getNumFrames() { return this.numFrames; }

	public boolean isDynamic(){
		return this.dynamicMask!=null;
	}

	public boolean isValid(int t, int pixel){
		if (this.dynamicMask!=null) return this.dynamicMask[t][pixel];
		if (this.fixedMask!=null)   return this.fixedMask[pixel];
		return true;
	}

	/** true if the pixel is valid in all frames */
	public boolean isAlwaysValid(int pixel){
		if (this.dynamicMask!=null) {
			for (int t=0;t<this.numFrames;t++) if (!this.dynamicMask[t][pixel]) return false;
			return true;
		}
		return isValid(0, pixel);
	}

	/** true if the pixel is valid in at least one frame, only those pixels get transformed */
	public boolean isEverValid(int pixel){
		if (this.dynamicMask!=null) {
			for (int t=0;t<this.numFrames;t++) if (this.dynamicMask[t][pixel]) return true;
			return false;
		}
		return isValid(0, pixel);
	}

	/**
	 * Indices (y*width+x, increasing) of the pixels that need a transform. Resolved once,
	 * before scheduling, so the workers never spend time on masked pixels.
	 */
	public int [] getPixelsToProcess(){
		int numPixels=this.width*this.height;
		int n=0;
		for (int i=0;i<numPixels;i++) if (isEverValid(i)) n++;
		int [] pixels=new int[n];
		n=0;
		for (int i=0;i<numPixels;i++) if (isEverValid(i)) pixels[n++]=i;
		return pixels;
	}

	/**
	 * Replaces invalid samples of a dynamically masked pixel so the transform sees a
	 * continuous series: each gap holds the last valid value, a leading gap takes the first
	 * valid value. Series of always-valid pixels are returned unchanged.
	 * @return false if the pixel has no valid sample at all
	 */
	public boolean fillInvalidSamples(int pixel, double [] series){
		if (this.dynamicMask==null) return isValid(0, pixel);
		int firstValid=-1;
		for (int t=0;t<this.numFrames;t++) if (this.dynamicMask[t][pixel]) {
			firstValid=t;
			break;
		}
		if (firstValid<0) return false;
		for (int t=0;t<firstValid;t++) series[t]=series[firstValid];
		double last=series[firstValid];
		for (int t=firstValid+1;t<this.numFrames;t++){
			if (this.dynamicMask[t][pixel]) last=series[t];
			else series[t]=last;
		}
		return true;
	}
}
