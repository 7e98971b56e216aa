/*
 **
 ** ProcessingSummary.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  ProcessingSummary.java is free software: you can redistribute it and/or modify
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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Statistics of a finished run */
public class ProcessingSummary {
	public static final int MAX_FAILURE_MESSAGES=10;

	private final int numPixels;
	private final int numMasked;
	private final int numTransformed;
	private final int numFailed;
	private final int numWorkers;
	private final double elapsedSeconds;
	private final List<String> failureMessages;

	public ProcessingSummary(int numPixels, int numMasked, int numTransformed, int numFailed,
			int numWorkers, double elapsedSeconds, List<String> failureMessages){
		this.numPixels=numPixels;
		this.numMasked=numMasked;
		this.numTransformed=numTransformed;
		this.numFailed=numFailed;
		this.numWorkers=numWorkers;
		this.elapsedSeconds=elapsedSeconds;
		this.failureMessages=Collections.unmodifiableList(new ArrayList<String>(failureMessages));
	}

	public int getNumPixels()      { return this.numPixels; }
	/** pixels skipped entirely because of the mask */
	public int getNumMasked()      { return this.numMasked; }
	/** pixels transformed without errors */
	public int getNumTransformed() { return this.numTransformed; }
	/** pixels filled with the sentinel after a numerical failure */
	public int getNumFailed()      { return this.numFailed; }
	public int getNumWorkers()     { return this.numWorkers; }
	public double getElapsedSeconds() { return this.elapsedSeconds; }
	/** first failure messages, at most MAX_FAILURE_MESSAGES */
	public List<String> getFailureMessages() { return this.failureMessages; }

	@Override
	public String toString(){
		return "Transformed "+this.numTransformed+" of "+this.numPixels+" pixels ("+this.numMasked+" masked, "+
				this.numFailed+" failed) using "+this.numWorkers+" thread(s) in "+
				String.format("%.3f",this.elapsedSeconds)+" sec";
	}
}
