/*
 **
 ** WaveletVolumes.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  WaveletVolumes.java is free software: you can redistribute it and/or modify
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

import java.util.Arrays;

/**
 * The four result volumes (phase, period, power, amplitude), each with the frames of the
 * (rescaled) input movie. Stored as 32-bit frames so they map directly on ImageJ
 * FloatProcessor stacks. Every pixel starts as the sentinel (NaN), pixels that are never
 * written (masked) stay that way.
 * <p>
 * Workers write different pixels concurrently, each pixel is written by one worker only.
 */
public class WaveletVolumes {
	public static final float SENTINEL=Float.NaN;

	public enum Output {
		PHASE("phase"), PERIOD("period"), POWER("power"), AMPLITUDE("amplitude");
		public final String suffix;
		Output(String suffix){ this.suffix=suffix; }
	}

	private final int width;
	private final int height;
	private final int numFrames;
	private final double dt;
	private final float [][][] volumes; // [Output.ordinal()][t][pixel]

	private WaveletVolumes(int width, int height, int numFrames, double dt){
		this.width=width;
		this.height=height;
		this.numFrames=numFrames;
		this.dt=dt;
		this.volumes=new float[Output.values().length][numFrames][width*height];
		for (float [][] volume:this.volumes) for (float [] frame:volume) Arrays.fill(frame, SENTINEL);
	}

	/**
	 * @throws ResourceAllocationException if there is not enough memory for the volumes
	 */
	public static WaveletVolumes allocate(int width, int height, int numFrames, double dt){
		try {
			return new WaveletVolumes(width, height, numFrames, dt);
		} catch (OutOfMemoryError e){
			throw new ResourceAllocationException("Not enough memory for 4 output volumes of "+numFrames+"x"+height+"x"+width+" pixels", e);
		}
	}

	public static WaveletVolumes allocateFor(Movie movie){
		return allocate(movie.getWidth(), movie.getHeight(), movie.getNumFrames(), movie.getDt());
	}

	public int getWidth()     { return this.width; }
	public int getHeight()    { return this.height; }
	public int getNumFrames() { return this.numFrames; }
	public double getDt()     { return this.dt; }

	/** Frames of one output volume, [t][y*width+x] */
	public float [][] getVolume(Output output){
		return this.volumes[output.ordinal()];
	}

	public float getValue(Output output, int t, int x, int y){
		return this.volumes[output.ordinal()][t][y*this.width+x];
	}

	/**
	 * Stores the ridge of a pixel, time points where the mask marks the pixel invalid
	 * keep the sentinel
	 */
	public void setPixel(int pixel, RidgeResult rr, MovieMask mask){
		if (rr.length()!=this.numFrames)
			throw new IllegalArgumentException("Ridge has "+rr.length()+" time points, volumes have "+this.numFrames);
		float [][] phase=    this.volumes[Output.PHASE.ordinal()];
		float [][] period=   this.volumes[Output.PERIOD.ordinal()];
		float [][] power=    this.volumes[Output.POWER.ordinal()];
		float [][] amplitude=this.volumes[Output.AMPLITUDE.ordinal()];
		for (int t=0;t<this.numFrames;t++){
			if ((mask!=null) && !mask.isValid(t, pixel)) {
				phase[t][pixel]=    SENTINEL;
				period[t][pixel]=   SENTINEL;
				power[t][pixel]=    SENTINEL;
				amplitude[t][pixel]=SENTINEL;
			} else {
				phase[t][pixel]=    toFloatPhase(rr.phase[t]);
				period[t][pixel]=   (float) rr.period[t];
				power[t][pixel]=    (float) rr.power[t];
				amplitude[t][pixel]=(float) rr.amplitude[t];
			}
		}
	}

	/** Phase rounded to float, within (-pi, pi] with pi rounded to float as well */
	static float toFloatPhase(double phase){
		float f=(float) phase;
		if (f<=-(float) Math.PI) f=(float) Math.PI;
		return f;
	}

	/** Fills all time points of a pixel with the sentinel */
	public void setSentinel(int pixel){
		for (float [][] volume:this.volumes) for (int t=0;t<this.numFrames;t++) volume[t][pixel]=SENTINEL;
	}

	/** 32-bit stack of one output, frame interval calibrated to dt */
	public ImagePlus toImagePlus(Output output, String title){
		ImageStack stack=new ImageStack(this.width,this.height);
		float [][] volume=this.volumes[output.ordinal()];
		for (int t=0;t<this.numFrames;t++)
			stack.addSlice(output.suffix+" t="+IJ.d2s(t*this.dt,3), new FloatProcessor(this.width,this.height,volume[t]));
		ImagePlus imp=new ImagePlus(title,stack);
		imp.setDimensions(1,1,this.numFrames);
		imp.getCalibration().frameInterval=this.dt;
		return imp;
	}

	/** All four outputs as ImageJ stacks, named baseTitle-phase, baseTitle-period, ... */
	public ImagePlus [] toImagePlus(String baseTitle){
		ImagePlus [] imps=new ImagePlus[Output.values().length];
		for (Output output:Output.values()) imps[output.ordinal()]=toImagePlus(output, baseTitle+"-"+output.suffix);
		return imps;
	}
}
