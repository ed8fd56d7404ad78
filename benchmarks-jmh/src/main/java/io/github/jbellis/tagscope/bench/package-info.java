/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * JMH benchmarks for the TagScope analysis strategies.
 * <p>
 * {@link io.github.jbellis.tagscope.bench.TagAnalysisBenchmark} times the heap ranking and the
 * hash table aggregation over the same synthetic records, with JMH warmup and forking. Use it
 * when the three-run comparison printed by {@code tagscope bench} is too noisy to call.
 *
 * <h2>Running Benchmarks</h2>
 *
 * <pre>
 * # Build the shaded JAR
 * mvn clean package -pl benchmarks-jmh -am
 *
 * # Run all benchmarks
 * java -jar benchmarks-jmh/target/benchmarks-jmh-*.jar
 *
 * # Run one record count
 * java -jar benchmarks-jmh/target/benchmarks-jmh-*.jar TagAnalysisBenchmark -p recordCount=100000
 * </pre>
 */
package io.github.jbellis.tagscope.bench;
