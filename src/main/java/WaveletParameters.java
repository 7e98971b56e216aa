/*
 **
 ** WaveletParameters.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  WaveletParameters.java is free software: you can redistribute it and/or modify
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
import ij.gui.GenericDialog;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;

/**
 * Parameters of the per-pixel wavelet analysis. Optional numeric parameters are "blank"
 * when NaN (as GenericDialog returns for an empty field), gaussSigma and rescaleFactor
 * are also off when 0.
 */
public class WaveletParameters {
	public enum MaskingMode    {NONE, FIXED, DYNAMIC}
	public enum PeriodSpacing  {LOG, LINEAR}
	public enum EnvelopeMethod {RMS, MAX}

	public static final int MAX_RESCALE_PERCENT=99;

	public double         gaussSigma=     Double.NaN;        // spatial smoothing, pixels
	public double         rescaleFactor=  Double.NaN;        // output size, percent of the input size
	public MaskingMode    maskingMode=    MaskingMode.NONE;
	public int            maskFrame=      0;                 // frame used for the fixed mask
	public double         maskThreshold=  Double.NaN;        // pixels below are masked
	public double         dt=             1.0;               // sampling interval
	public double         tMin=           20.0;              // shortest period to scan
	public double         tMax=           30.0;              // longest period to scan
	public int            nT=             200;               // number of periods
	public PeriodSpacing  periodSpacing=  PeriodSpacing.LOG;
	public double         tCutoff=        Double.NaN;        // sinc detrending cut-off period
	public double         windowSize=     Double.NaN;        // amplitude normalization window, time units
	public EnvelopeMethod envelopeMethod= EnvelopeMethod.RMS;
	public int            numWorkers=     8;
	public int            chunkSize=      256;               // pixels handed to a worker at once
	public boolean        keepPreprocessed=false;            // keep smoothed/rescaled movie in the result
	public int            debugLevel=     1;

	public WaveletParameters(){}

	public WaveletParameters(double dt, double tMin, double tMax, int nT){
		this.dt=dt;
		this.tMin=tMin;
		this.tMax=tMax;
		this.nT=nT;
	}

	public static boolean isSet(double value){
		return !Double.isNaN(value);
	}

	public boolean smoothingEnabled()     { return isSet(this.gaussSigma) && (this.gaussSigma>0); }
	public boolean rescalingEnabled()     { return isSet(this.rescaleFactor) && (this.rescaleFactor>0); }
	public boolean detrendingEnabled()    { return isSet(this.tCutoff); }
	public boolean normalizationEnabled() { return isSet(this.windowSize); }

	/**
	 * Checks parameters that do not depend on the movie
	 * @throws WaveletParameterException naming the first offending parameter
	 */
	public void validate(){
		if (!(this.dt>0))                   throw new WaveletParameterException("dt", "sampling interval must be positive, got "+this.dt);
		if (!(this.tMin>0))                 throw new WaveletParameterException("tMin", "must be positive, got "+this.tMin);
		if (!(this.tMax>0))                 throw new WaveletParameterException("tMax", "must be positive, got "+this.tMax);
		if (!(this.tMin<this.tMax))         throw new WaveletParameterException("tMin", "must be smaller than tMax ("+this.tMin+" >= "+this.tMax+")");
		if (this.nT<1)                      throw new WaveletParameterException("nT", "need at least one period, got "+this.nT);
		if (this.gaussSigma<0)              throw new WaveletParameterException("gaussSigma", "must not be negative, got "+this.gaussSigma);
		if ((this.rescaleFactor<0) || (this.rescaleFactor>MAX_RESCALE_PERCENT))
			throw new WaveletParameterException("rescaleFactor", "must be within 0.."+MAX_RESCALE_PERCENT+"%, upscaling is not supported, got "+this.rescaleFactor);
		if (this.tCutoff<=0)                throw new WaveletParameterException("tCutoff", "must be positive, got "+this.tCutoff);
		if (this.windowSize<=0)             throw new WaveletParameterException("windowSize", "must be positive, got "+this.windowSize);
		if (this.maskingMode==null)         throw new WaveletParameterException("maskingMode", "not specified");
		if ((this.maskingMode!=MaskingMode.NONE) && !isSet(this.maskThreshold))
			throw new WaveletParameterException("maskThreshold", "required for "+this.maskingMode+" masking");
		if ((this.maskingMode==MaskingMode.FIXED) && (this.maskFrame<0))
			throw new WaveletParameterException("maskFrame", "must not be negative, got "+this.maskFrame);
		if (this.numWorkers<1)              throw new WaveletParameterException("numWorkers", "need at least one worker, got "+this.numWorkers);
		if (this.chunkSize<1)               throw new WaveletParameterException("chunkSize", "must be positive, got "+this.chunkSize);
		if (this.periodSpacing==null)       throw new WaveletParameterException("periodSpacing", "not specified");
		if (this.envelopeMethod==null)      throw new WaveletParameterException("envelopeMethod", "not specified");
	}

	/** Checks parameters together with the movie they will be applied to */
	public void validate(Movie movie){
		validate();
		if ((this.maskingMode==MaskingMode.FIXED) && (this.maskFrame>=movie.getNumFrames()))
			throw new WaveletParameterException("maskFrame", "frame "+this.maskFrame+" is outside of the movie ("+movie.getNumFrames()+" frames)");
		if (Math.abs(movie.getDt()-this.dt) > 1E-9*this.dt)
			throw new WaveletParameterException("dt", "movie is sampled every "+movie.getDt()+", parameters specify "+this.dt);
	}

	/** Non-fatal problems worth reporting */
	public List<String> warnings(){
		List<String> warnings=new ArrayList<String>();
		if (this.tMin<2*this.dt)
			warnings.add("Shortest period "+this.tMin+" is below the Nyquist limit "+(2*this.dt));
		if (detrendingEnabled() && (this.tCutoff<2*this.tMax))
			warnings.add("Detrending cut-off period "+this.tCutoff+" is smaller than twice the longest period ("+(2*this.tMax)+
					"), a large part of the signal will be removed");
		return warnings;
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"gaussSigma",      this.gaussSigma+"");
		properties.setProperty(prefix+"rescaleFactor",   this.rescaleFactor+"");
		properties.setProperty(prefix+"maskingMode",     this.maskingMode.name());
		properties.setProperty(prefix+"maskFrame",       this.maskFrame+"");
		properties.setProperty(prefix+"maskThreshold",   this.maskThreshold+"");
		properties.setProperty(prefix+"dt",              this.dt+"");
		properties.setProperty(prefix+"tMin",            this.tMin+"");
		properties.setProperty(prefix+"tMax",            this.tMax+"");
		properties.setProperty(prefix+"nT",              this.nT+"");
		properties.setProperty(prefix+"periodSpacing",   this.periodSpacing.name());
		properties.setProperty(prefix+"tCutoff",         this.tCutoff+"");
		properties.setProperty(prefix+"windowSize",      this.windowSize+"");
		properties.setProperty(prefix+"envelopeMethod",  this.envelopeMethod.name());
		properties.setProperty(prefix+"numWorkers",      this.numWorkers+"");
		properties.setProperty(prefix+"chunkSize",       this.chunkSize+"");
		properties.setProperty(prefix+"keepPreprocessed",this.keepPreprocessed+"");
		properties.setProperty(prefix+"debugLevel",      this.debugLevel+"");
	}

	public void getProperties(String prefix,Properties properties){
		if (properties.getProperty(prefix+"gaussSigma")!=null)
			this.gaussSigma=Double.parseDouble(properties.getProperty(prefix+"gaussSigma"));
		if (properties.getProperty(prefix+"rescaleFactor")!=null)
			this.rescaleFactor=Double.parseDouble(properties.getProperty(prefix+"rescaleFactor"));
		if (properties.getProperty(prefix+"maskingMode")!=null)
			this.maskingMode=MaskingMode.valueOf(properties.getProperty(prefix+"maskingMode"));
		if (properties.getProperty(prefix+"maskFrame")!=null)
			this.maskFrame=Integer.parseInt(properties.getProperty(prefix+"maskFrame"));
		if (properties.getProperty(prefix+"maskThreshold")!=null)
			this.maskThreshold=Double.parseDouble(properties.getProperty(prefix+"maskThreshold"));
		if (properties.getProperty(prefix+"dt")!=null)
			this.dt=Double.parseDouble(properties.getProperty(prefix+"dt"));
		if (properties.getProperty(prefix+"tMin")!=null)
			this.tMin=Double.parseDouble(properties.getProperty(prefix+"tMin"));
		if (properties.getProperty(prefix+"tMax")!=null)
			this.tMax=Double.parseDouble(properties.getProperty(prefix+"tMax"));
		if (properties.getProperty(prefix+"nT")!=null)
			this.nT=Integer.parseInt(properties.getProperty(prefix+"nT"));
		if (properties.getProperty(prefix+"periodSpacing")!=null)
			this.periodSpacing=PeriodSpacing.valueOf(properties.getProperty(prefix+"periodSpacing"));
		if (properties.getProperty(prefix+"tCutoff")!=null)
			this.tCutoff=Double.parseDouble(properties.getProperty(prefix+"tCutoff"));
		if (properties.getProperty(prefix+"windowSize")!=null)
			this.windowSize=Double.parseDouble(properties.getProperty(prefix+"windowSize"));
		if (properties.getProperty(prefix+"envelopeMethod")!=null)
			this.envelopeMethod=EnvelopeMethod.valueOf(properties.getProperty(prefix+"envelopeMethod"));
		if (properties.getProperty(prefix+"numWorkers")!=null)
			this.numWorkers=Integer.parseInt(properties.getProperty(prefix+"numWorkers"));
		if (properties.getProperty(prefix+"chunkSize")!=null)
			this.chunkSize=Integer.parseInt(properties.getProperty(prefix+"chunkSize"));
		if (properties.getProperty(prefix+"keepPreprocessed")!=null)
			this.keepPreprocessed=Boolean.parseBoolean(properties.getProperty(prefix+"keepPreprocessed"));
		if (properties.getProperty(prefix+"debugLevel")!=null)
			this.debugLevel=Integer.parseInt(properties.getProperty(prefix+"debugLevel"));
	}

	/**
	 * Saves parameters as an XML file, blank values are written as "NaN"
	 */
	public void saveXML(String pathname) throws ConfigurationException{
		XMLConfiguration hConfig=new XMLConfiguration();
		hConfig.setRootElementName("WaveletParameters");
		Properties properties=new Properties();
		setProperties("", properties);
		for (String name:properties.stringPropertyNames()) hConfig.addProperty(name, properties.getProperty(name));
		hConfig.save(new File(pathname));
	}

	/**
	 * Reads parameters saved by {@link #saveXML(String)}, missing entries keep current values
	 */
	public void loadXML(String pathname) throws ConfigurationException{
		XMLConfiguration hConfig=new XMLConfiguration(new File(pathname));
		hConfig.setThrowExceptionOnMissing(false);
		Properties current=new Properties();
		setProperties("", current);
		Properties properties=new Properties();
		for (String name:current.stringPropertyNames()){
			String value=hConfig.getString(name);
			if (value!=null) properties.setProperty(name, value);
		}
		getProperties("", properties);
	}

	public boolean showDialog(String title) {
		GenericDialog gd = new GenericDialog(title);
		gd.addMessage("=== Preprocessing (leave blank to disable) ===");
		gd.addNumericField("Gaussian smoothing sigma",          this.gaussSigma,     2, 6, "pixels");
		gd.addNumericField("Rescale to",                        this.rescaleFactor,  0, 6, "% of the input size");
		gd.addChoice      ("Masking",                           names(MaskingMode.values()), this.maskingMode.name());
		gd.addNumericField("Mask frame (fixed masking)",        this.maskFrame,      0);
		gd.addNumericField("Mask threshold",                    this.maskThreshold,  3, 8, "intensity");
		gd.addMessage("=== Wavelet analysis ===");
		gd.addNumericField("Sampling interval",                 this.dt,             3, 8, "time units");
		gd.addNumericField("Lowest period",                     this.tMin,           3, 8, "time units");
		gd.addNumericField("Highest period",                    this.tMax,           3, 8, "time units");
		gd.addNumericField("Number of periods",                 this.nT,             0);
		gd.addChoice      ("Period spacing",                    names(PeriodSpacing.values()), this.periodSpacing.name());
		gd.addNumericField("Detrending cut-off period",         this.tCutoff,        3, 8, "time units");
		gd.addNumericField("Amplitude normalization window",    this.windowSize,     3, 8, "time units");
		gd.addChoice      ("Amplitude envelope",                names(EnvelopeMethod.values()), this.envelopeMethod.name());
		gd.addMessage("=== Processing ===");
		gd.addNumericField("Worker threads",                    this.numWorkers,     0);
		gd.addNumericField("Pixels per work chunk",             this.chunkSize,      0);
		gd.addCheckbox    ("Show preprocessed movie",           this.keepPreprocessed);
		gd.addNumericField("Debug level",                       this.debugLevel,     0);
		gd.showDialog();
		if (gd.wasCanceled()) return false;
		this.gaussSigma=                gd.getNextNumber();
		this.rescaleFactor=             gd.getNextNumber();
		this.maskingMode=               MaskingMode.valueOf(gd.getNextChoice());
		this.maskFrame=           (int) gd.getNextNumber();
		this.maskThreshold=             gd.getNextNumber();
		this.dt=                        gd.getNextNumber();
		this.tMin=                      gd.getNextNumber();
		this.tMax=                      gd.getNextNumber();
		this.nT=                  (int) gd.getNextNumber();
		this.periodSpacing=             PeriodSpacing.valueOf(gd.getNextChoice());
		this.tCutoff=                   gd.getNextNumber();
		this.windowSize=                gd.getNextNumber();
		this.envelopeMethod=            EnvelopeMethod.valueOf(gd.getNextChoice());
		this.numWorkers=          (int) gd.getNextNumber();
		this.chunkSize=           (int) gd.getNextNumber();
		this.keepPreprocessed=          gd.getNextBoolean();
		this.debugLevel=          (int) gd.getNextNumber();
		return true;
	}

	private static String [] names(Enum<?> [] values){
		String [] names=new String[values.length];
		for (int i=0;i<values.length;i++) names[i]=values[i].name();
		return names;
	}

	@Override
	public WaveletParameters clone(){
		WaveletParameters wp=new WaveletParameters();
		Properties properties=new Properties();
		setProperties("", properties);
		wp.getProperties("", properties);
		return wp;
	}
}
