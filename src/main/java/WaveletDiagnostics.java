/*
 **
 ** WaveletDiagnostics.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  WaveletDiagnostics.java is free software: you can redistribute it and/or modify
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
 * Receiver of warnings, progress and the final status of a run. Processing classes never
 * print themselves. progress() is called from worker threads.
 */
public interface WaveletDiagnostics {
	void warning(String message);

	void status(String message);

	/** @param done chunks of pixels finished so far out of total */
	void progress(int done, int total);

	/**
	 * Called once at the end of a run
	 * @param summary processing statistics, null if the run failed
	 * @param failure fatal error that aborted the run, null on success
	 */
	void finished(ProcessingSummary summary, Throwable failure);

	WaveletDiagnostics SILENT=new WaveletDiagnostics() {
		public void warning(String message) {}
		public void status(String message) {}
		public void progress(int done, int total) {}
		public void finished(ProcessingSummary summary, Throwable failure) {}
	};
}
