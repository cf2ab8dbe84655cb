/*
 * Copyright (c) 2016-2024 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package pulse.util.function;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

public class TuplesTest {

	@Test
	public void appendWidensTheTuple() {
		Tuple3<Integer, String, Boolean> tuple = Tuples.append(Tuples.of(1, "a"), true);

		assertThat(tuple).isEqualTo(Tuples.of(1, "a", true));
		assertThat(tuple.getT3()).isTrue();
		assertThat(tuple.size()).isEqualTo(3);
	}

	@Test
	public void tuplesOfDifferentArityAreNotEqual() {
		assertThat(Tuples.of(1, 2)).isNotEqualTo(Tuples.of(1, 2, 3));
		assertThat(Tuples.of(1, 2, 3)).isNotEqualTo(Tuples.of(1, 2));
	}

	@Test
	public void tupleSixExposesEveryValue() {
		Tuple6<Integer, Integer, Integer, Integer, Integer, Integer> tuple = Tuples.append(
				Tuples.append(Tuples.append(Tuples.append(Tuples.of(1, 2), 3), 4), 5), 6);

		assertThat(tuple.toList()).containsExactly(1, 2, 3, 4, 5, 6);
		assertThat(tuple).containsExactly(1, 2, 3, 4, 5, 6)
		                 .hasToString("[1,2,3,4,5,6]");
		assertThat(tuple.hashCode()).isEqualTo(Tuples.of(1, 2, 3, 4, 5, 6).hashCode());
	}

	@Test
	public void nullValuesAreRejected() {
		assertThatNullPointerException().isThrownBy(() -> Tuples.of(1, null));
	}
}
