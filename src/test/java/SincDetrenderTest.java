/*
 **
 ** SincDetrenderTest.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  SincDetrenderTest.java is free software: you can redistribute it and/or modify
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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class SincDetrenderTest {

	@Test
	public void testDisabledIsIdentity() {
		SincDetrender detrender = new SincDetrender(Double.NaN, 1.0, 50);
		assertFalse(detrender.isEnabled());
		double[] series = SyntheticMovies.cosine(50, 1.0, 10.0, 1.0);
		assertSame(series, detrender.detrend(series));
	}

	@Test
	public void testKernelIsOddAndNormalized() {
		double[] kernel = new SincDetrender(50.0, 1.0, 200).getKernel();
		assertEquals(199, kernel.length);
		double sum = 0.0;
		for (double k : kernel) sum += k;
		assertEquals(1.0, sum, 1E-12);
		for (int i = 0; i < kernel.length / 2; i++)
			assertEquals(kernel[i], kernel[kernel.length - 1 - i], 1E-15);
		assertEquals(201, new SincDetrender(50.0, 1.0, 201).getKernel().length);
	}

	@Test
	public void testConstantSeriesDetrendsToZero() {
		double[] series = new double[120];
		java.util.Arrays.fill(series, 42.0);
		double[] detrended = new SincDetrender(30.0, 1.0, series.length).detrend(series);
		for (double d : detrended) assertEquals(0.0, d, 1E-9);
	}

	@Test
	public void testOffsetRemovedOscillationKept() {
		int n = 200;
		double[] series = SyntheticMovies.cosine(n, 1.0, 10.0, 1.0);
		for (int t = 0; t < n; t++) series[t] += 5.0;
		double[] detrended = new SincDetrender(50.0, 1.0, n).detrend(series);
		for (int t = 40; t < 160; t++)
			assertEquals(Math.cos(2 * Math.PI * t / 10.0), detrended[t], 0.05);
	}

	@Test
	public void testLinearTrendRemovedInTheMiddle() {
		int n = 200;
		double[] series = SyntheticMovies.cosine(n, 1.0, 10.0, 1.0);
		for (int t = 0; t < n; t++) series[t] += 0.05 * t;
		SincDetrender detrender = new SincDetrender(50.0, 1.0, n);
		double[] trend = detrender.trend(series);
		double[] detrended = detrender.detrend(series);
		for (int t = 80; t < 120; t++) {
			assertEquals(0.05 * t, trend[t], 0.1);
			assertEquals(series[t] - trend[t], detrended[t], 1E-12);
		}
	}

	@Test
	public void testShortSeries() {
		SincDetrender detrender = new SincDetrender(10.0, 1.0, 2);
		assertTrue(detrender.isEnabled());
		double[] detrended = detrender.detrend(new double[] {3.0, 5.0});
		assertEquals(2, detrended.length);
	}
}
