/*
 **
 ** SpatialWaveletResult.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  SpatialWaveletResult.java is free software: you can redistribute it and/or modify
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

/** Output of a successful run */
public class SpatialWaveletResult {
	private final WaveletVolumes volumes;
	private final Movie preprocessed;
	private final MovieMask mask;
	private final ProcessingSummary summary;

	public SpatialWaveletResult(WaveletVolumes volumes, Movie preprocessed, MovieMask mask, ProcessingSummary summary){
		this.volumes=volumes;
		this.preprocessed=preprocessed;
		this.mask=mask;
		this.summary=summary;
	}

	public WaveletVolumes getVolumes()    { return this.volumes; }
	/** smoothed/rescaled input, null unless requested with keepPreprocessed */
	public Movie getPreprocessed()        { return this.preprocessed; }
	public MovieMask getMask()            { return this.mask; }
	public ProcessingSummary getSummary() { return this.summary; }
}
