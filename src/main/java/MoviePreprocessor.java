/*
 **
 ** MoviePreprocessor.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  MoviePreprocessor.java is free software: you can redistribute it and/or modify
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
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * Spatial preprocessing of every frame: optional Gaussian smoothing, then optional
 * downscaling, and the pixel mask derived from the result. Smoothing and scaling never
 * mix different time points.
 */
public class MoviePreprocessor {
	private final WaveletParameters wp;
	private final DoubleGaussianBlur gaussianBlur=new DoubleGaussianBlur();

	public MoviePreprocessor(WaveletParameters wp){
		this.wp=wp;
	}

	/**
	 * Smoothed and rescaled movie. With both steps disabled the input movie itself is returned.
	 */
	public Movie preprocess(Movie movie){
		Movie result=movie;
		if (this.wp.smoothingEnabled())  result=smooth(result, this.wp.gaussSigma);
		if (this.wp.rescalingEnabled())  result=rescale(result, this.wp.rescaleFactor);
		return result;
	}

	public Movie smooth(Movie movie, double sigma){
		float [][] frames=new float[movie.getNumFrames()][];
		for (int t=0;t<frames.length;t++)
			frames[t]=this.gaussianBlur.blurFrame(movie.getFrame(t), movie.getWidth(), movie.getHeight(), sigma);
		return new Movie(frames, movie.getWidth(), movie.getHeight(), movie.getDt());
	}

	/** Frame dimension after scaling to percent of the original, never less than 1 */
	public static int rescaledSize(int size, double percent){
		return Math.max(1, (int) Math.round(size*percent/100.0));
	}

	/**
	 * Downscales every frame to the specified percentage of its size (bilinear, averaging
	 * when downsizing)
	 */
	public Movie rescale(Movie movie, double percent){
		if (!(percent>0) || (percent>100))
			throw new WaveletParameterException("rescaleFactor", "only downscaling is supported, got "+percent+"%");
		int width= rescaledSize(movie.getWidth(),  percent);
		int height=rescaledSize(movie.getHeight(), percent);
		float [][] frames=new float[movie.getNumFrames()][];
		for (int t=0;t<frames.length;t++){
			FloatProcessor fp=new FloatProcessor(movie.getWidth(), movie.getHeight(), movie.getFrame(t).clone());
			fp.setInterpolationMethod(ImageProcessor.BILINEAR);
			ImageProcessor scaled=fp.resize(width, height, true);
			frames[t]=(float []) scaled.getPixels();
		}
		return new Movie(frames, width, height, movie.getDt());
	}

	/** Pixel mask for the (preprocessed) movie according to the masking mode */
	public MovieMask createMask(Movie movie){
		switch (this.wp.maskingMode){
		case FIXED:
			if ((this.wp.maskFrame<0) || (this.wp.maskFrame>=movie.getNumFrames()))
				throw new WaveletParameterException("maskFrame", "frame "+this.wp.maskFrame+" is outside of the movie ("+movie.getNumFrames()+" frames)");
			return MovieMask.thresholdFrame(movie, this.wp.maskFrame, this.wp.maskThreshold);
		case DYNAMIC:
			return MovieMask.thresholdEachFrame(movie, this.wp.maskThreshold);
		default:
			return MovieMask.allValid(movie.getWidth(), movie.getHeight(), movie.getNumFrames());
		}
	}
}
