/*
 **
 ** WaveletVolumesTest.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  WaveletVolumesTest.java is free software: you can redistribute it and/or modify
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
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import ij.ImagePlus;

import org.junit.Test;

public class WaveletVolumesTest {

	private static RidgeResult ridge(int length){
		RidgeResult rr=new RidgeResult(length);
		for (int t=0;t<length;t++){
			rr.phase[t]=0.1*t;
			rr.period[t]=10.0;
			rr.power[t]=2.0;
			rr.amplitude[t]=0.5;
		}
		return rr;
	}

	@Test
	public void testAllocatedWithSentinel() {
		WaveletVolumes volumes=WaveletVolumes.allocate(3, 2, 4, 0.5);
		for (WaveletVolumes.Output output:WaveletVolumes.Output.values()) {
			float [][] volume=volumes.getVolume(output);
			assertEquals(4, volume.length);
			for (float [] frame:volume) {
				assertEquals(6, frame.length);
				for (float v:frame) assertTrue(Float.isNaN(v));
			}
		}
	}

	@Test
	public void testSetPixelHonorsDynamicMask() {
		boolean [][] masks=new boolean[4][6];
		for (int t=0;t<4;t++) masks[t][4]= t!=2;
		WaveletVolumes volumes=WaveletVolumes.allocate(3, 2, 4, 1.0);
		volumes.setPixel(4, ridge(4), MovieMask.dynamic(masks, 3, 2));
		assertEquals(0.3f, volumes.getValue(WaveletVolumes.Output.PHASE, 3, 1, 1), 1E-6f);
		assertEquals(10f, volumes.getValue(WaveletVolumes.Output.PERIOD, 0, 1, 1), 0f);
		assertEquals(2f, volumes.getValue(WaveletVolumes.Output.POWER, 1, 1, 1), 0f);
		assertEquals(0.5f, volumes.getValue(WaveletVolumes.Output.AMPLITUDE, 3, 1, 1), 0f);
		for (WaveletVolumes.Output output:WaveletVolumes.Output.values())
			assertTrue(Float.isNaN(volumes.getValue(output, 2, 1, 1)));
		assertTrue(Float.isNaN(volumes.getValue(WaveletVolumes.Output.POWER, 0, 0, 0)));

		volumes.setSentinel(4);
		assertTrue(Float.isNaN(volumes.getValue(WaveletVolumes.Output.POWER, 1, 1, 1)));
	}

	@Test
	public void testFloatPhaseStaysInRange() {
		float pi=(float) Math.PI;
		assertEquals(pi, WaveletVolumes.toFloatPhase(RidgeResult.wrapPhase(-Math.PI+1E-9)), 0f);
		assertEquals(pi, WaveletVolumes.toFloatPhase(Math.PI), 0f);
		assertEquals(0.5f, WaveletVolumes.toFloatPhase(0.5), 0f);
		for (int i=0;i<=1000;i++){
			float f=WaveletVolumes.toFloatPhase(RidgeResult.wrapPhase(-Math.PI+i*2*Math.PI/1000+1E-12));
			assertTrue(f > -pi && f <= pi);
		}

		RidgeResult rr=ridge(4);
		rr.phase[1]=-Math.PI+1E-9;
		WaveletVolumes volumes=WaveletVolumes.allocate(1, 1, 4, 1.0);
		volumes.setPixel(0, rr, null);
		assertEquals(pi, volumes.getValue(WaveletVolumes.Output.PHASE, 1, 0, 0), 0f);
	}

	@Test(expected=IllegalArgumentException.class)
	public void testRidgeLengthMismatch() {
		WaveletVolumes.allocate(2, 2, 5, 1.0).setPixel(0, ridge(4), null);
	}

	@Test
	public void testImageStacks() {
		WaveletVolumes volumes=WaveletVolumes.allocate(3, 2, 4, 0.25);
		volumes.setPixel(0, ridge(4), null);
		ImagePlus [] imps=volumes.toImagePlus("cells");
		assertEquals(4, imps.length);
		assertEquals("cells-phase", imps[0].getTitle());
		assertEquals("cells-period", imps[1].getTitle());
		assertEquals("cells-power", imps[2].getTitle());
		assertEquals("cells-amplitude", imps[3].getTitle());
		for (ImagePlus imp:imps) {
			assertEquals(4, imp.getStackSize());
			assertEquals(3, imp.getWidth());
			assertEquals(2, imp.getHeight());
			assertEquals(0.25, imp.getCalibration().frameInterval, 0.0);
		}
		assertEquals(10f, imps[1].getStack().getProcessor(2).getf(0, 0), 0f);
	}
}
