/*
 **
 ** Movie.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  Movie.java is free software: you can redistribute it and/or modify
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
import ij.IJ;
import ij.ImagePlus;
import ij.ImageStack;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * Image stack (t, y, x) sampled every dt. Each frame is stored as a row-scan float
 * array of width*height, the way ImageJ keeps FloatProcessor pixels.
 * Instances are never modified after construction, every processing step creates a new one.
 */
public class Movie {
	private final float [][] frames; // [t][y*width+x]
	private final int width;
	private final int height;
	private final double dt;

	/**
	 * @param frames frame pixel arrays, each of length width*height. Not copied: the movie
	 *               takes them over and the caller must not modify them afterwards.
	 * @param width  frame width
	 * @param height frame height
	 * @param dt     sampling interval
	 */
	public Movie(float [][] frames, int width, int height, double dt){
		if ((frames==null) || (frames.length==0))
			throw new IllegalArgumentException("Movie needs at least one frame");
		if ((width<=0) || (height<=0))
			throw new IllegalArgumentException("Illegal frame size "+width+"x"+height);
		for (int t=0;t<frames.length;t++){
			if (frames[t].length!=width*height)
				throw new IllegalArgumentException("Frame "+t+" has "+frames[t].length+
						" pixels, expected "+(width*height));
		}
		this.frames=frames;
		this.width=width;
		this.height=height;
		this.dt=dt;
	}

	public static Movie fromStack(double [][][] data, double dt){ // [t][y][x]
		int height=data[0].length;
		int width=data[0][0].length;
		float [][] frames=new float[data.length][width*height];
		for (int t=0;t<data.length;t++) for (int y=0;y<height;y++) for (int x=0;x<width;x++)
			frames[t][y*width+x]=(float) data[t][y][x];
		return new Movie(frames,width,height,dt);
	}

	/**
	 * Takes every slice of the image stack as one time point. Pixels are converted to float
	 * and copied, the source image is left untouched.
	 */
	public static Movie fromImagePlus(ImagePlus imp, double dt){
		ImageStack stack=imp.getStack();
		float [][] frames=new float[stack.getSize()][];
		for (int t=0;t<frames.length;t++){
			ImageProcessor ip=stack.getProcessor(t+1);
			frames[t]=((float []) ip.convertToFloat().getPixels()).clone();
		}
		return new Movie(frames,stack.getWidth(),stack.getHeight(),dt);
	}

	public int getNumFrames() { return this.frames.length; }
	public int getWidth()     { return this.width; }
	public int getHeight()    { return this.height; }
	public int getNumPixels() { return this.width*this.height; }
	public double getDt()     { return this.dt; }

	public float getValue(int t, int x, int y){
		return this.frames[t][y*this.width+x];
	}

	/** Read-only view of a frame, callers must not modify it */
	public float [] getFrame(int t){
		return this.frames[t];
	}

	public double [] getFrameDouble(int t){
		float [] frame=this.frames[t];
		double [] result=new double [frame.length];
		for (int i=0;i<frame.length;i++) result[i]=frame[i];
		return result;
	}

	/** Time series of one pixel, index is y*width+x */
	public double [] getTimeSeries(int pixel){
		double [] series=new double[this.frames.length];
		getTimeSeries(pixel,series);
		return series;
	}

	public void getTimeSeries(int pixel, double [] series){
		for (int t=0;t<this.frames.length;t++) series[t]=this.frames[t][pixel];
	}

	public ImagePlus toImagePlus(String title){
		ImageStack stack=new ImageStack(this.width,this.height);
		for (int t=0;t<this.frames.length;t++)
			stack.addSlice("t="+IJ.d2s(t*this.dt,3),new FloatProcessor(this.width,this.height,this.frames[t].clone()));
		ImagePlus imp=new ImagePlus(title,stack);
		imp.setDimensions(1,1,this.frames.length);
		imp.getCalibration().frameInterval=this.dt;
		return imp;
	}
}
