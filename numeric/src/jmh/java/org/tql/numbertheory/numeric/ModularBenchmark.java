/*
 * Copyright contributors to tql.
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
package org.tql.numbertheory.numeric;

import org.tql.numbertheory.datatypes.IntegerType;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

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
public class ModularBenchmark {
  protected static final int SAMPLE_SIZE = 30_000;
  // Largest prime below 2^32
  protected static final long MODULUS = 4294967291L;
  protected Modular[] aPool;
  protected Modular[] bPool;
  protected int index;

  @Setup(Level.Iteration)
  public void setUp() {
    final ModularRing ring = ModularRing.of(IntegerType.UNSIGNED_LONG, MODULUS);
    aPool = new Modular[SAMPLE_SIZE];
    bPool = new Modular[SAMPLE_SIZE];

    final ThreadLocalRandom random = ThreadLocalRandom.current();
    for (int i = 0; i < SAMPLE_SIZE; i++) {
      aPool[i] = ring.valueOf(random.nextLong());
      // Non-zero, so that every element is invertible
      bPool[i] = ring.valueOf(random.nextLong(1, MODULUS));
    }

    index = 0;
  }

  @Benchmark
  public void add(final Blackhole blackhole) {
    blackhole.consume(aPool[index].add(bPool[index]));
    index = (index + 1) % SAMPLE_SIZE;
  }

  @Benchmark
  public void multiply(final Blackhole blackhole) {
    blackhole.consume(aPool[index].multiply(bPool[index]));
    index = (index + 1) % SAMPLE_SIZE;
  }

  @Benchmark
  public void inverse(final Blackhole blackhole) {
    blackhole.consume(bPool[index].inverse());
    index = (index + 1) % SAMPLE_SIZE;
  }

  @Benchmark
  public void pow(final Blackhole blackhole) {
    blackhole.consume(aPool[index].pow(MODULUS - 2));
    index = (index + 1) % SAMPLE_SIZE;
  }
}
