/*
 **
 ** Spatial_Wavelet_Analysis.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  Spatial_Wavelet_Analysis.java is free software: you can redistribute it and/or modify
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
import ij.WindowManager;
import ij.io.OpenDialog;
import ij.io.SaveDialog;
import ij.plugin.PlugIn;

import java.util.Properties;

import org.apache.commons.configuration.ConfigurationException;

/**
 * ImageJ entry point: per-pixel wavelet analysis of the current image stack. Every stack
 * slice is one time point. Shows phase, period, power and amplitude stacks (and the
 * preprocessed input if requested).
 * <p>
 * Arguments (plugins.config): "" - run, "load" - read parameters from XML, "save" - write them.
 */
public class Spatial_Wavelet_Analysis implements PlugIn {
	static Properties PROPERTIES=new Properties();
	static final String PROPERTIES_PREFIX="WAVELET_PARAMETERS.";
	static WaveletParameters WAVELET_PARAMETERS=new WaveletParameters();

	public void run(String arg) {
		if ("load".equals(arg)) {
			loadParameters();
			return;
		}
		if ("save".equals(arg)) {
			saveParameters();
			return;
		}
		ImagePlus imp=WindowManager.getCurrentImage();
		if (imp==null) {
			IJ.showMessage("Error","There are no images open\nProcess canceled");
			return;
		}
		WAVELET_PARAMETERS.getProperties(PROPERTIES_PREFIX, PROPERTIES);
		double frameInterval=imp.getCalibration().frameInterval;
		if (frameInterval>0) WAVELET_PARAMETERS.dt=frameInterval;
		if (!WAVELET_PARAMETERS.showDialog("Spatial wavelet analysis of "+imp.getTitle())) return;
		WAVELET_PARAMETERS.setProperties(PROPERTIES_PREFIX, PROPERTIES);
		ImagePlus [] results;
		try {
			results=analyze(imp, WAVELET_PARAMETERS, new IJDiagnostics(WAVELET_PARAMETERS.debugLevel));
		} catch (WaveletParameterException e) {
			IJ.showMessage("Error","Invalid parameter "+e.getParameterName()+"\n"+e.getMessage());
			return;
		} catch (RuntimeException e) {
			IJ.showMessage("Error","Wavelet analysis failed\n"+e.getMessage());
			return;
		}
		for (ImagePlus result:results) result.show();
	}

	/**
	 * Runs the analysis on an image stack
	 * @return phase, period, power and amplitude stacks, followed by the preprocessed movie
	 * when wp.keepPreprocessed is set
	 */
	public static ImagePlus [] analyze(ImagePlus imp, WaveletParameters wp, WaveletDiagnostics diagnostics){
		Movie movie=Movie.fromImagePlus(imp, wp.dt);
		SpatialWaveletResult result=new SpatialWaveletProcessor(wp, diagnostics).process(movie);
		String title=imp.getShortTitle();
		ImagePlus [] outputs=result.getVolumes().toImagePlus(title);
		if (result.getPreprocessed()==null) return outputs;
		ImagePlus [] all=new ImagePlus[outputs.length+1];
		System.arraycopy(outputs, 0, all, 0, outputs.length);
		all[outputs.length]=result.getPreprocessed().toImagePlus(title+"-preprocessed");
		return all;
	}

	private void loadParameters(){
		OpenDialog od=new OpenDialog("Load wavelet parameters", "");
		if (od.getFileName()==null) return;
		String path=od.getDirectory()+od.getFileName();
		try {
			WAVELET_PARAMETERS.loadXML(path);
		} catch (ConfigurationException e) {
			IJ.showMessage("Error","Failed to read "+path+"\n"+e.getMessage());
			return;
		}
		WAVELET_PARAMETERS.setProperties(PROPERTIES_PREFIX, PROPERTIES);
		IJ.log("Wavelet parameters loaded from "+path);
	}

	private void saveParameters(){
		WAVELET_PARAMETERS.getProperties(PROPERTIES_PREFIX, PROPERTIES);
		SaveDialog sd=new SaveDialog("Save wavelet parameters", "wavelet-parameters", ".xml");
		if (sd.getFileName()==null) return;
		String path=sd.getDirectory()+sd.getFileName();
		try {
			WAVELET_PARAMETERS.saveXML(path);
		} catch (ConfigurationException e) {
			IJ.showMessage("Error","Failed to write "+path+"\n"+e.getMessage());
			return;
		}
		IJ.log("Wavelet parameters saved to "+path);
	}
}
