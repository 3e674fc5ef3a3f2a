/*
 * Copyright contributors to gf2m.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License is distributed on
 * an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package org.gf2m.field;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import org.gf2m.datatypes.StorageWidth;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@State(Scope.Thread)
@Warmup(iterations = 2, time = 1, timeUnit = TimeUnit.SECONDS)
@OutputTimeUnit(value = TimeUnit.NANOSECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@BenchmarkMode(Mode.AverageTime)
public class GaloisFieldBenchmark {
  protected static final int SAMPLE_SIZE = 30_000;

  // Same GF(2^8) on both backends
  protected ComputedElement[] computedPool;
  protected LookupElement[] lookupPool;
  // GF(2^64), computed only
  protected ComputedElement[] widePool;
  protected long[] rawPool;
  protected int index;

  @Setup(Level.Iteration)
  public void setUp() {
    final ComputedGaloisField computed =
        ComputedGaloisField.of(StorageWidth.U8, KnownPolynomials.REED_SOLOMON_GF256);
    final LookupGaloisField lookup =
        LookupGaloisField.of(StorageWidth.U8, KnownPolynomials.REED_SOLOMON_GF256);
    final ComputedGaloisField wide =
        ComputedGaloisField.of(StorageWidth.U64, KnownPolynomials.GF2_64);

    computedPool = new ComputedElement[SAMPLE_SIZE];
    lookupPool = new LookupElement[SAMPLE_SIZE];
    widePool = new ComputedElement[SAMPLE_SIZE];
    rawPool = new long[SAMPLE_SIZE];

    final ThreadLocalRandom random = ThreadLocalRandom.current();
    for (int i = 0; i < SAMPLE_SIZE; i++) {
      // Non-zero so inverse never throws.
      final long v = 1 + random.nextInt(255);
      computedPool[i] = computed.newElement(v);
      lookupPool[i] = lookup.newElement(v);
      long w = random.nextLong();
      widePool[i] = wide.newElement(w == 0 ? 1 : w);
      rawPool[i] = random.nextLong();
    }

    index = 0;
  }

  private int next() {
    final int i = index;
    index = (index + 1) % SAMPLE_SIZE;
    return i;
  }

  @Benchmark
  public void computedMul(final Blackhole blackhole) {
    final int i = next();
    blackhole.consume(computedPool[i].mul(computedPool[index]));
  }

  @Benchmark
  public void lookupMul(final Blackhole blackhole) {
    final int i = next();
    blackhole.consume(lookupPool[i].mul(lookupPool[index]));
  }

  @Benchmark
  public void computedInverse(final Blackhole blackhole) {
    blackhole.consume(computedPool[next()].inverse());
  }

  @Benchmark
  public void lookupInverse(final Blackhole blackhole) {
    blackhole.consume(lookupPool[next()].inverse());
  }

  @Benchmark
  public void wideMul(final Blackhole blackhole) {
    final int i = next();
    blackhole.consume(widePool[i].mul(widePool[index]));
  }

  @Benchmark
  public void wideInverse(final Blackhole blackhole) {
    blackhole.consume(widePool[next()].inverse());
  }

  @Benchmark
  public void clmulWide(final Blackhole blackhole) {
    final int i = next();
    blackhole.consume(CarrylessMultiply.clmulWide(rawPool[i], rawPool[index]));
  }
}
