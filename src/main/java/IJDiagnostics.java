/*
 **
 ** IJDiagnostics.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  IJDiagnostics.java is free software: you can redistribute it and/or modify
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

/** Reports to the ImageJ log window, status bar and progress bar */
public class IJDiagnostics implements WaveletDiagnostics {
	private final int debugLevel;
	private final long startTime=System.nanoTime();

	public IJDiagnostics(int debugLevel){
		this.debugLevel=debugLevel;
	}

	public void warning(String message) {
		IJ.log("WARNING: "+message);
	}

	public void status(String message) {
		IJ.showStatus(message);
		if (this.debugLevel>1) System.out.println(message+" : "+IJ.d2s(0.000000001*(System.nanoTime()-this.startTime),3));
	}

	public void progress(int done, int total) {
		IJ.showProgress(done, total);
		if (this.debugLevel>0) IJ.log("Processed "+IJ.d2s(100.0*done/total,1)+"%..");
	}

	public void finished(ProcessingSummary summary, Throwable failure) {
		IJ.showProgress(1.0);
		if (failure!=null) {
			IJ.log("Wavelet analysis FAILED: "+failure.getMessage());
			if (this.debugLevel>1) failure.printStackTrace();
			IJ.showStatus("Wavelet analysis failed");
			return;
		}
		IJ.log(summary.toString());
		if (this.debugLevel>1) for (String msg:summary.getFailureMessages()) IJ.log("  "+msg);
		IJ.showStatus("Wavelet analysis done in "+IJ.d2s(summary.getElapsedSeconds(),3)+" sec");
	}
}
