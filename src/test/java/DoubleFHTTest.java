/*
 **
 ** DoubleFHTTest.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  DoubleFHTTest.java is free software: you can redistribute it and/or modify
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
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class DoubleFHTTest {

	@Test
	public void testPaddedSize() {
		assertEquals(4, DoubleFHT.paddedSize(1));
		assertEquals(4, DoubleFHT.paddedSize(4));
		assertEquals(16, DoubleFHT.paddedSize(10));
		assertEquals(256, DoubleFHT.paddedSize(200));
		assertTrue(DoubleFHT.isPowerOf2(64));
		assertFalse(DoubleFHT.isPowerOf2(48));
	}

	@Test
	public void testDeltaGivesCas() {
		int n = 16;
		double[] data = new double[n];
		data[3] = 1.0;
		new DoubleFHT().transform(data);
		for (int k = 0; k < n; k++) {
			double theta = 2 * Math.PI * k * 3 / n;
			assertEquals("bin " + k, Math.cos(theta) + Math.sin(theta), data[k], 1E-12);
		}
	}

	@Test
	public void testInverseRestoresData() {
		int n = 64;
		double[] data = new double[n];
		for (int i = 0; i < n; i++) data[i] = Math.sin(0.37 * i) + 0.01 * i * i;
		double[] copy = data.clone();
		DoubleFHT fht = new DoubleFHT();
		fht.transform(data);
		fht.inverseTransform(data);
		for (int i = 0; i < n; i++) assertEquals(copy[i], data[i], 1E-9);
	}

	@Test
	public void testAnalyticFilterOfCosine() {
		int n = 64;
		int k0 = 5;
		double[] data = new double[n];
		for (int t = 0; t < n; t++) data[t] = Math.cos(2 * Math.PI * k0 * t / n);
		DoubleFHT fht = new DoubleFHT();
		fht.transform(data);
		double[] filter = new double[n];
		for (int k = 1; k <= n / 2; k++) filter[k] = 1.0; // positive frequencies only
		double[] re = new double[n];
		double[] im = new double[n];
		fht.analyticFilter(data, filter, re, im);
		for (int t = 0; t < n; t++) {
			double theta = 2 * Math.PI * k0 * t / n;
			assertEquals(0.5 * Math.cos(theta), re[t], 1E-12);
			assertEquals(0.5 * Math.sin(theta), im[t], 1E-12);
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsNonPowerOf2() {
		new DoubleFHT().transform(new double[12]);
	}
}
