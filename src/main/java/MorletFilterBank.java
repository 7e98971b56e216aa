/*
 **
 ** MorletFilterBank.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  MorletFilterBank.java is free software: you can redistribute it and/or modify
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
 * Analytic Morlet wavelets for every period of the grid, tabulated in the frequency domain
 * for one padded transform length. Read only after construction, shared by all workers.
 * <p>
 * For scale s the filter is sqrt(2*pi*s/dt) * pi^(-1/4) * exp(-(s*w-omega0)^2/2) for
 * positive angular frequencies w and 0 otherwise. The sqrt(s) factor gives every scale the
 * same energy, the scale is chosen so the response of a sine with the grid period peaks at
 * that scale: s = T*(omega0+sqrt(2+omega0^2))/(4*pi).
 */
public class MorletFilterBank {
	public static final double DEFAULT_OMEGA0=2*Math.PI;
	private static final double PI_POW_MINUS_QUARTER=Math.pow(Math.PI, -0.25);

	private final PeriodGrid periodGrid;
	private final double dt;
	private final double omega0;
	private final int size;
	private final double [] scales;
	private final double [][] filters; // [period index][FFT bin]

	public MorletFilterBank(PeriodGrid periodGrid, double dt, int size){
		this(periodGrid, dt, size, DEFAULT_OMEGA0);
	}

	/**
	 * @param periodGrid periods to build wavelets for
	 * @param dt         sampling interval
	 * @param size       padded transform length, power of 2
	 * @param omega0     central angular frequency of the mother wavelet
	 */
	public MorletFilterBank(PeriodGrid periodGrid, double dt, int size, double omega0){
		if (!DoubleFHT.isPowerOf2(size))
			throw new IllegalArgumentException("Filter bank size should be a power of 2, got "+size);
		this.periodGrid=periodGrid;
		this.dt=dt;
		this.omega0=omega0;
		this.size=size;
		int nT=periodGrid.size();
		this.scales=new double[nT];
		this.filters=new double[nT][size];
		double periodToScale=(omega0+Math.sqrt(2+omega0*omega0))/(4*Math.PI);
		double dOmega=2*Math.PI/(size*dt);
		for (int i=0;i<nT;i++){
			double s=periodGrid.getPeriod(i)*periodToScale;
			this.scales[i]=s;
			double norm=Math.sqrt(2*Math.PI*s/dt)*PI_POW_MINUS_QUARTER;
			double [] filter=this.filters[i];
			for (int k=1;k<=size/2;k++){ // DC and negative frequencies stay 0
				double d=s*k*dOmega-omega0;
				filter[k]=norm*Math.exp(-0.5*d*d);
			}
		}
	}

	public int getSize()                 { return this.size; }
	public double getDt()                { return this.dt; }
	public double getOmega0()            { return this.omega0; }
	public PeriodGrid getPeriodGrid()    { return this.periodGrid; }
	public int getNumScales()            { return this.scales.length; }
	public double getScale(int index)    { return this.scales[index]; }
	public double [] getFilter(int index){ return this.filters[index]; }

	/**
	 * Converts the modulus of a wavelet coefficient back to the amplitude of the sine that
	 * produced it, inverting the filter normalization (a sine of amplitude A gives
	 * |W| = A/2 * pi^(-1/4) * sqrt(2*pi*s/dt) on the ridge).
	 */
	public double modulusToAmplitude(double modulus, int index){
		return 2*modulus/(PI_POW_MINUS_QUARTER*Math.sqrt(2*Math.PI*this.scales[index]/this.dt));
	}
}
