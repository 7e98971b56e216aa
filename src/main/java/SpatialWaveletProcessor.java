/*
 **
 ** SpatialWaveletProcessor.java
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **  
 **  SpatialWaveletProcessor.java is free software: you can redistribute it and/or modify
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
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the wavelet analysis pixel by pixel: preprocesses the movie, resolves the mask,
 * splits the pixels to transform into chunks and lets a pool of threads detrend,
 * transform and normalize them. Results land in the output volumes at the pixel's own
 * position, so the order in which chunks finish does not matter.
 * <p>
 * Numerical problems of a single pixel only replace that pixel with the sentinel. Any
 * other failure in a worker stops all workers and is rethrown, no partial result is
 * returned.
 */
public class SpatialWaveletProcessor {
	private final WaveletParameters wp;
	private final WaveletDiagnostics diagnostics;
	private final int availableProcessors;

	public SpatialWaveletProcessor(WaveletParameters wp, WaveletDiagnostics diagnostics){
		this(wp, diagnostics, Runtime.getRuntime().availableProcessors());
	}

	/** @param availableProcessors upper limit for the number of worker threads */
	SpatialWaveletProcessor(WaveletParameters wp, WaveletDiagnostics diagnostics, int availableProcessors){
		this.wp=wp;
		this.diagnostics=(diagnostics!=null)? diagnostics : WaveletDiagnostics.SILENT;
		this.availableProcessors=Math.max(1, availableProcessors);
	}

	public SpatialWaveletProcessor(WaveletParameters wp){
		this(wp, null);
	}

	/**
	 * @param movie input movie, not modified
	 * @return the four volumes with the shape of the preprocessed movie
	 * @throws WaveletParameterException on invalid parameters, before any pixel is processed
	 * @throws ResourceAllocationException when output or workers can not be set up
	 */
	public SpatialWaveletResult process(Movie movie){
		try {
			SpatialWaveletResult result=processMovie(movie);
			this.diagnostics.finished(result.getSummary(), null);
			return result;
		} catch (RuntimeException e){
			this.diagnostics.finished(null, e);
			throw e;
		} catch (Error e){
			this.diagnostics.finished(null, e);
			throw e;
		}
	}

	private SpatialWaveletResult processMovie(Movie movie){
		final long startTime=System.nanoTime();
		this.wp.validate(movie);
		for (String warning:this.wp.warnings()) this.diagnostics.warning(warning);

		MoviePreprocessor preprocessor=new MoviePreprocessor(this.wp);
		if (this.wp.smoothingEnabled() || this.wp.rescalingEnabled()) this.diagnostics.status("Preprocessing "+movie.getNumFrames()+" frames");
		final Movie preprocessed=preprocessor.preprocess(movie);
		final MovieMask mask=preprocessor.createMask(preprocessed);
		final int [] pixels=mask.getPixelsToProcess();
		final WaveletVolumes volumes=WaveletVolumes.allocateFor(preprocessed);

		int numFrames=preprocessed.getNumFrames();
		PeriodGrid periodGrid=new PeriodGrid(this.wp);
		final MorletFilterBank filterBank;
		try {
			filterBank=WaveletAnalyzer.createFilterBank(periodGrid, this.wp.dt, numFrames);
		} catch (OutOfMemoryError e){
			throw new ResourceAllocationException("Not enough memory for "+periodGrid.size()+" wavelet filters", e);
		}
		final SincDetrender detrender=new SincDetrender(this.wp.tCutoff, this.wp.dt, numFrames);
		final AmplitudeNormalizer normalizer=new AmplitudeNormalizer(this.wp.windowSize, this.wp.dt, this.wp.envelopeMethod);

		int chunkSize=getChunkSize(pixels.length);
		int numChunks=getNumChunks(pixels.length, chunkSize);
		int numWorkers=getNumWorkers(numChunks);
		this.diagnostics.status("Computing the transforms for "+pixels.length+" pixels of "+preprocessed.getNumPixels()+
				" using "+numWorkers+" thread(s)");
		List<String> failureMessages=new ArrayList<String>();
		int numFailed=transformPixels(preprocessed, mask, pixels, volumes, filterBank, detrender, normalizer,
				chunkSize, numWorkers, failureMessages);

		ProcessingSummary summary=new ProcessingSummary(
				preprocessed.getNumPixels(),
				preprocessed.getNumPixels()-pixels.length,
				pixels.length-numFailed,
				numFailed,
				numWorkers,
				0.000000001*(System.nanoTime()-startTime),
				failureMessages);
		return new SpatialWaveletResult(volumes, this.wp.keepPreprocessed? preprocessed : null, mask, summary);
	}

	/** Configured chunk size, never more than the number of pixels to process */
	int getChunkSize(int numPixels){
		return Math.max(1, Math.min(this.wp.chunkSize, numPixels));
	}

	static int getNumChunks(int numPixels, int chunkSize){
		return numPixels/chunkSize + (((numPixels%chunkSize)!=0)? 1 : 0);
	}

	/** Requested workers, limited by available processors (with a warning) and the work available */
	int getNumWorkers(int numChunks){
		int numWorkers=this.wp.numWorkers;
		int available=this.availableProcessors;
		if (numWorkers>available){
			this.diagnostics.warning("Requested "+numWorkers+" threads but only "+available+" processors are available, using "+available);
			numWorkers=available;
		}
		if (numWorkers>numChunks) numWorkers=Math.max(1, numChunks);
		return numWorkers;
	}

	private int transformPixels(
			final Movie movie,
			final MovieMask mask,
			final int [] pixels,
			final WaveletVolumes volumes,
			final MorletFilterBank filterBank,
			final SincDetrender detrender,
			final AmplitudeNormalizer normalizer,
			final int chunkSize,
			int numWorkers,
			final List<String> failureMessages){
		final int numChunks=getNumChunks(pixels.length, chunkSize);
		final int width=movie.getWidth();
		final int numFrames=movie.getNumFrames();
		final Thread[] threads = new Thread[numWorkers];
		final AtomicInteger chunkIndex = new AtomicInteger(0);
		final AtomicInteger chunksDone = new AtomicInteger(0);
		final AtomicInteger numFailed =  new AtomicInteger(0);
		final AtomicReference<Throwable> fatal = new AtomicReference<Throwable>(null);
		final WaveletDiagnostics diagnostics=this.diagnostics;
		for (int ithread = 0; ithread < threads.length; ithread++) {
			threads[ithread] = new Thread() {
				public void run() {
					try {
						WaveletAnalyzer analyzer=new WaveletAnalyzer(filterBank, numFrames);
						double [] series=new double[numFrames];
						for (int nChunk = chunkIndex.getAndIncrement(); (nChunk < numChunks) && (fatal.get()==null); nChunk = chunkIndex.getAndIncrement()) {
							int last=(int) Math.min(pixels.length, (long) (nChunk+1)*chunkSize);
							for (int i=nChunk*chunkSize;i<last;i++){
								int pixel=pixels[i];
								try {
									RidgeResult rr=transformPixel(movie, mask, pixel, series, detrender, analyzer, normalizer);
									volumes.setPixel(pixel, rr, mask);
								} catch (PixelComputationException e){
									pixelFailed(volumes, pixel, e.atPixel(pixel%width, pixel/width), numFailed, failureMessages);
								} catch (ArithmeticException e){
									pixelFailed(volumes, pixel, new PixelComputationException(e.getMessage(), e).atPixel(pixel%width, pixel/width),
											numFailed, failureMessages);
								}
							}
							int done=chunksDone.incrementAndGet();
							if ((10*done/numChunks) > (10*(done-1)/numChunks)) diagnostics.progress(done, numChunks);
						}
					} catch (Throwable e){
						fatal.compareAndSet(null, e);
					}
				}
			};
		}
		try {
			startAndJoin(threads);
		} catch (RuntimeException e){ // interrupted, let the workers stop after their current chunk
			fatal.compareAndSet(null, e);
			throw e;
		} catch (OutOfMemoryError e){
			fatal.compareAndSet(null, new ResourceAllocationException("Could not start "+threads.length+" worker threads", e));
			joinStarted(threads);
		}
		Throwable failure=fatal.get();
		if (failure!=null){
			if (failure instanceof RuntimeException) throw (RuntimeException) failure;
			if (failure instanceof OutOfMemoryError) throw new ResourceAllocationException("Out of memory while transforming pixels", failure);
			if (failure instanceof Error) throw (Error) failure;
			throw new RuntimeException(failure);
		}
		return numFailed.get();
	}

	/**
	 * Detrends, transforms and normalizes one pixel. Invalid samples of a dynamically
	 * masked pixel are filled before the transform.
	 */
	static RidgeResult transformPixel(
			Movie movie,
			MovieMask mask,
			int pixel,
			double [] series,
			SincDetrender detrender,
			WaveletAnalyzer analyzer,
			AmplitudeNormalizer normalizer){
		movie.getTimeSeries(pixel, series);
		if (!mask.fillInvalidSamples(pixel, series))
			throw new PixelComputationException("no valid samples");
		RidgeResult rr=analyzer.analyze(detrender.detrend(series));
		rr.amplitude=normalizer.normalize(rr.amplitude);
		return rr;
	}

	private static void pixelFailed(WaveletVolumes volumes, int pixel, PixelComputationException e,
			AtomicInteger numFailed, List<String> failureMessages){
		volumes.setSentinel(pixel);
		numFailed.incrementAndGet();
		synchronized (failureMessages){
			if (failureMessages.size()<ProcessingSummary.MAX_FAILURE_MESSAGES) failureMessages.add(e.getMessage());
		}
	}

	/** Start all given threads and wait on each of them until all are done. */
	public static void startAndJoin(Thread[] threads)
	{
		for (int ithread = 0; ithread < threads.length; ++ithread)
		{
			threads[ithread].setPriority(Thread.NORM_PRIORITY);
			threads[ithread].start();
		}
		try
		{
			for (int ithread = 0; ithread < threads.length; ++ithread)
				threads[ithread].join();
		} catch (InterruptedException ie)
		{
			Thread.currentThread().interrupt();
			throw new RuntimeException(ie);
		}
	}

	private static void joinStarted(Thread[] threads){
		for (Thread thread:threads){
			if ((thread==null) || (thread.getState()==Thread.State.NEW)) continue;
			try {
				thread.join();
			} catch (InterruptedException ie){
				Thread.currentThread().interrupt();
				throw new RuntimeException(ie);
			}
		}
	}
}
