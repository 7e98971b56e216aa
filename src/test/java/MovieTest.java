/*
 **
 ** MovieTest.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  MovieTest.java is free software: you can redistribute it and/or modify
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

import ij.ImagePlus;

import org.junit.Test;

public class MovieTest {

	@Test
	public void testImagePlusPixelsAreCopied() {
		ImagePlus imp=SyntheticMovies.constant(3, 2, 2, 4f, 1.0).toImagePlus("copy");
		Movie movie=Movie.fromImagePlus(imp, 1.0);
		((float []) imp.getStack().getProcessor(2).getPixels())[0]=-1f;
		assertEquals(4f, movie.getValue(1, 0, 0), 0f);

		Movie source=SyntheticMovies.constant(3, 2, 2, 4f, 1.0);
		ImagePlus shown=source.toImagePlus("shown");
		((float []) shown.getStack().getProcessor(1).getPixels())[3]=-1f;
		assertEquals(4f, source.getValue(0, 1, 1), 0f);
	}

	@Test
	public void testStackLayout() {
		double [][][] data=new double[2][3][4]; // [t][y][x]
		data[1][2][3]=7.0;
		Movie movie=Movie.fromStack(data, 0.5);
		assertEquals(4, movie.getWidth());
		assertEquals(3, movie.getHeight());
		assertEquals(2, movie.getNumFrames());
		assertEquals(7f, movie.getValue(1, 3, 2), 0f);
		assertEquals(7.0, movie.getTimeSeries(2*4+3)[1], 0.0);
	}

	@Test(expected=IllegalArgumentException.class)
	public void testFrameSizeChecked() {
		new Movie(new float[][] {new float[6], new float[5]}, 3, 2, 1.0);
	}
}
