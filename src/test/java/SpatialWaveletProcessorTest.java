/*
 **
 ** SpatialWaveletProcessorTest.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  SpatialWaveletProcessorTest.java is free software: you can redistribute it and/or modify
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
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class SpatialWaveletProcessorTest {

	private static WaveletParameters parameters(double tMin, double tMax, int nT){
		WaveletParameters wp=new WaveletParameters(1.0, tMin, tMax, nT);
		wp.numWorkers=1;
		wp.chunkSize=4;
		return wp;
	}

	@Test
	public void testConstantMovie() {
		Movie movie=SyntheticMovies.constant(10, 5, 5, 1f, 1.0);
		SyntheticMovies.RecordingDiagnostics diagnostics=new SyntheticMovies.RecordingDiagnostics();
		SpatialWaveletResult result=new SpatialWaveletProcessor(parameters(2, 8, 4), diagnostics).process(movie);
		WaveletVolumes volumes=result.getVolumes();
		assertEquals(5, volumes.getWidth());
		assertEquals(5, volumes.getHeight());
		assertEquals(10, volumes.getNumFrames());
		for (int t=0;t<10;t++) for (int i=0;i<25;i++) {
			assertEquals(0f, volumes.getVolume(WaveletVolumes.Output.POWER)[t][i], 0f);
			assertEquals(0f, volumes.getVolume(WaveletVolumes.Output.AMPLITUDE)[t][i], 0f);
			assertTrue(Float.isNaN(volumes.getVolume(WaveletVolumes.Output.PHASE)[t][i]));
			assertTrue(Float.isNaN(volumes.getVolume(WaveletVolumes.Output.PERIOD)[t][i]));
		}
		assertTrue(diagnostics.warnings.isEmpty());
		assertEquals(1, diagnostics.finishedCalls);
		assertNull(diagnostics.failure);
		assertSame(result.getSummary(), diagnostics.summary);
		assertEquals(25, diagnostics.summary.getNumTransformed());
		assertEquals(0, diagnostics.summary.getNumFailed());
		assertNull(result.getPreprocessed());
	}

	@Test
	public void testOscillationFound() {
		Movie movie=SyntheticMovies.oscillating(128, 4, 4, 10.0, 1.0, 10.0, 1.0);
		WaveletParameters wp=parameters(5, 20, 20);
		PeriodGrid grid=new PeriodGrid(wp);
		WaveletVolumes volumes=new SpatialWaveletProcessor(wp).process(movie).getVolumes();
		float [][] phase=volumes.getVolume(WaveletVolumes.Output.PHASE);
		float [][] period=volumes.getVolume(WaveletVolumes.Output.PERIOD);
		for (int t=0;t<128;t++) for (int i=0;i<16;i++){
			assertTrue(phase[t][i] > -(float) Math.PI && phase[t][i] <= (float) Math.PI);
			assertEquals(grid.getPeriod(grid.nearestIndex(period[t][i])), period[t][i], 1E-4);
			assertTrue(volumes.getVolume(WaveletVolumes.Output.POWER)[t][i] >= 0f);
		}
		for (int t=32;t<96;t++) for (int i=0;i<16;i++)
			assertEquals(10.0, period[t][i], 1.0);
	}

	@Test
	public void testResultDoesNotDependOnWorkers() {
		Movie movie=SyntheticMovies.oscillating(40, 6, 7, 3.0, 2.0, 8.0, 1.0);
		WaveletParameters single=parameters(4, 16, 12);
		single.numWorkers=1;
		single.chunkSize=3;
		single.tCutoff=30;
		single.windowSize=10;
		WaveletParameters multi=single.clone();
		multi.numWorkers=4;
		SpatialWaveletResult r1=new SpatialWaveletProcessor(single, null, 8).process(movie);
		SpatialWaveletResult r4=new SpatialWaveletProcessor(multi, null, 8).process(movie);
		assertEquals(1, r1.getSummary().getNumWorkers());
		assertEquals(4, r4.getSummary().getNumWorkers());
		WaveletVolumes v1=r1.getVolumes();
		WaveletVolumes v4=r4.getVolumes();
		for (WaveletVolumes.Output output:WaveletVolumes.Output.values())
			for (int t=0;t<40;t++)
				assertArrayEquals(output+" t="+t, v1.getVolume(output)[t], v4.getVolume(output)[t], 0f);
	}

	@Test
	public void testWorkersLimitedByProcessorsAndChunks() {
		WaveletParameters wp=parameters(4, 16, 8);
		wp.numWorkers=6;
		SyntheticMovies.RecordingDiagnostics diagnostics=new SyntheticMovies.RecordingDiagnostics();
		SpatialWaveletProcessor processor=new SpatialWaveletProcessor(wp, diagnostics, 3);
		assertEquals(3, processor.getNumWorkers(100));
		assertEquals(1, diagnostics.warnings.size());
		assertEquals(2, processor.getNumWorkers(2));
		assertEquals(1, processor.getNumWorkers(0));
		assertEquals(6, new SpatialWaveletProcessor(wp, null, 16).getNumWorkers(100));
	}

	@Test
	public void testHugeChunkSize() {
		WaveletParameters wp=parameters(4, 16, 8);
		wp.chunkSize=Integer.MAX_VALUE;
		wp.numWorkers=2;
		SpatialWaveletResult result=new SpatialWaveletProcessor(wp, null, 2).process(SyntheticMovies.oscillating(32, 5, 5, 10.0, 1.0, 8.0, 1.0));
		assertEquals(25, result.getSummary().getNumTransformed());
		assertEquals(1, result.getSummary().getNumWorkers());
		WaveletVolumes volumes=result.getVolumes();
		for (WaveletVolumes.Output output:WaveletVolumes.Output.values())
			for (int t=0;t<32;t++) for (float v:volumes.getVolume(output)[t]) assertFalse(output+" t="+t, Float.isNaN(v));
		assertEquals(1, SpatialWaveletProcessor.getNumChunks(25, 25));
		assertEquals(3, SpatialWaveletProcessor.getNumChunks(25, 10));
		assertEquals(1, SpatialWaveletProcessor.getNumChunks(Integer.MAX_VALUE, Integer.MAX_VALUE));
	}

	@Test
	public void testFixedMask() {
		int width=4, height=3;
		Movie source=SyntheticMovies.oscillating(32, height, width, 10.0, 1.0, 8.0, 1.0);
		float [][] frames=new float[32][];
		for (int t=0;t<32;t++){
			frames[t]=source.getFrame(t).clone();
			for (int y=0;y<height;y++) frames[t][y*width]=0f;
		}
		WaveletParameters wp=parameters(4, 16, 8);
		wp.maskingMode=WaveletParameters.MaskingMode.FIXED;
		wp.maskThreshold=5.0;
		SpatialWaveletResult result=new SpatialWaveletProcessor(wp).process(new Movie(frames, width, height, 1.0));
		WaveletVolumes volumes=result.getVolumes();
		for (int t=0;t<32;t++) for (int y=0;y<height;y++) for (int x=0;x<width;x++){
			for (WaveletVolumes.Output output:WaveletVolumes.Output.values()){
				float v=volumes.getValue(output, t, x, y);
				if (x==0) assertTrue(Float.isNaN(v));
				else assertFalse(output+" at "+x+","+y, Float.isNaN(v));
			}
		}
		assertEquals(height, result.getSummary().getNumMasked());
		assertEquals(width*height-height, result.getSummary().getNumTransformed());
	}

	@Test
	public void testDynamicMask() {
		int width=3, height=3;
		Movie source=SyntheticMovies.oscillating(40, height, width, 10.0, 1.0, 8.0, 1.0);
		float [][] frames=new float[40][];
		for (int t=0;t<40;t++){
			frames[t]=source.getFrame(t).clone();
			if ((t>=20) && (t<30)) frames[t][1*width+1]=0f; // pixel (1,1) drops out
			frames[t][2*width+2]=0f;                         // pixel (2,2) never valid
		}
		WaveletParameters wp=parameters(4, 16, 8);
		wp.maskingMode=WaveletParameters.MaskingMode.DYNAMIC;
		wp.maskThreshold=5.0;
		SpatialWaveletResult result=new SpatialWaveletProcessor(wp).process(new Movie(frames, width, height, 1.0));
		WaveletVolumes volumes=result.getVolumes();
		assertTrue(result.getMask().isDynamic());
		for (int t=0;t<40;t++){
			boolean dropped=(t>=20) && (t<30);
			assertEquals(dropped, Float.isNaN(volumes.getValue(WaveletVolumes.Output.POWER, t, 1, 1)));
			assertEquals(dropped, Float.isNaN(volumes.getValue(WaveletVolumes.Output.PERIOD, t, 1, 1)));
			assertTrue(Float.isNaN(volumes.getValue(WaveletVolumes.Output.AMPLITUDE, t, 2, 2)));
			assertFalse(Float.isNaN(volumes.getValue(WaveletVolumes.Output.PHASE, t, 0, 0)));
		}
		assertEquals(1, result.getSummary().getNumMasked());
		assertEquals(8, result.getSummary().getNumTransformed());
	}

	@Test
	public void testPixelFailureIsIsolated() {
		Movie source=SyntheticMovies.oscillating(32, 3, 3, 10.0, 1.0, 8.0, 1.0);
		float [][] frames=new float[32][];
		for (int t=0;t<32;t++) frames[t]=source.getFrame(t).clone();
		frames[5][4]=Float.NaN;
		SyntheticMovies.RecordingDiagnostics diagnostics=new SyntheticMovies.RecordingDiagnostics();
		SpatialWaveletResult result=new SpatialWaveletProcessor(parameters(4, 16, 8), diagnostics).process(new Movie(frames, 3, 3, 1.0));
		ProcessingSummary summary=result.getSummary();
		assertEquals(1, summary.getNumFailed());
		assertEquals(8, summary.getNumTransformed());
		assertEquals(1, summary.getFailureMessages().size());
		assertTrue(summary.getFailureMessages().get(0).startsWith("pixel (1,1)"));
		WaveletVolumes volumes=result.getVolumes();
		for (int t=0;t<32;t++){
			assertTrue(Float.isNaN(volumes.getValue(WaveletVolumes.Output.POWER, t, 1, 1)));
			assertFalse(Float.isNaN(volumes.getValue(WaveletVolumes.Output.POWER, t, 0, 1)));
		}
		assertNull(diagnostics.failure);
	}

	@Test
	public void testWorkerFailureAbortsRun() {
		final IllegalStateException progressFailure=new IllegalStateException("progress display closed");
		SyntheticMovies.RecordingDiagnostics diagnostics=new SyntheticMovies.RecordingDiagnostics(){
			@Override
			public synchronized void progress(int done, int total) {
				throw progressFailure;
			}
		};
		WaveletParameters wp=parameters(4, 16, 8);
		wp.chunkSize=1;
		try {
			new SpatialWaveletProcessor(wp, diagnostics).process(SyntheticMovies.oscillating(32, 4, 4, 0.0, 1.0, 8.0, 1.0));
			fail("worker failure was not reported");
		} catch (IllegalStateException e) {
			assertSame(progressFailure, e);
		}
		assertEquals(1, diagnostics.finishedCalls);
		assertNull(diagnostics.summary);
		assertSame(progressFailure, diagnostics.failure);
	}

	@Test
	public void testInvalidParametersRejectedBeforeProcessing() {
		SyntheticMovies.RecordingDiagnostics diagnostics=new SyntheticMovies.RecordingDiagnostics();
		try {
			new SpatialWaveletProcessor(parameters(20, 10, 8), diagnostics).process(SyntheticMovies.constant(8, 2, 2, 1f, 1.0));
			fail("tMin >= tMax accepted");
		} catch (WaveletParameterException e) {
			assertEquals("tMin", e.getParameterName());
		}
		assertTrue(diagnostics.statuses.isEmpty());
		assertEquals(0, diagnostics.progressCalls);
		assertTrue(diagnostics.failure instanceof WaveletParameterException);
	}

	@Test
	public void testNyquistWarning() {
		SyntheticMovies.RecordingDiagnostics diagnostics=new SyntheticMovies.RecordingDiagnostics();
		new SpatialWaveletProcessor(parameters(1, 8, 4), diagnostics).process(SyntheticMovies.oscillating(16, 2, 2, 0.0, 1.0, 4.0, 1.0));
		assertEquals(1, diagnostics.warnings.size());
		assertTrue(diagnostics.warnings.get(0).contains("Nyquist"));
		assertNotNull(diagnostics.summary);
	}

	@Test
	public void testPreprocessedMovieKept() {
		WaveletParameters wp=parameters(4, 16, 8);
		wp.gaussSigma=1.0;
		wp.rescaleFactor=50;
		wp.keepPreprocessed=true;
		SpatialWaveletResult result=new SpatialWaveletProcessor(wp).process(SyntheticMovies.oscillating(24, 8, 8, 5.0, 1.0, 8.0, 1.0));
		assertNotNull(result.getPreprocessed());
		assertEquals(4, result.getPreprocessed().getWidth());
		assertEquals(4, result.getVolumes().getWidth());
		assertEquals(4, result.getVolumes().getHeight());
		assertEquals(24, result.getVolumes().getNumFrames());
		assertEquals(16, result.getSummary().getNumPixels());
	}
}
