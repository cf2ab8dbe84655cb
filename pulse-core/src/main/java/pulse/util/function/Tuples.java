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

/**
 * A {@literal Tuples} is an immutable {@link java.util.Collection} of objects, each of
 * which can be of an arbitrary type.
 */
public abstract class Tuples {

	/**
	 * Create a {@link Tuple2} with the given objects.
	 *
	 * @param t1   The first value in the tuple. Not null.
	 * @param t2   The second value in the tuple. Not null.
	 * @param <T1> The type of the first value.
	 * @param <T2> The type of the second value.
	 * @return The new {@link Tuple2}.
	 */
	public static <T1, T2> Tuple2<T1, T2> of(T1 t1, T2 t2) {
		return new Tuple2<>(t1, t2);
	}

	public static <T1, T2, T3> Tuple3<T1, T2, T3> of(T1 t1, T2 t2, T3 t3) {
		return new Tuple3<>(t1, t2, t3);
	}

	public static <T1, T2, T3, T4> Tuple4<T1, T2, T3, T4> of(T1 t1, T2 t2, T3 t3, T4 t4) {
		return new Tuple4<>(t1, t2, t3, t4);
	}

	public static <T1, T2, T3, T4, T5> Tuple5<T1, T2, T3, T4, T5> of(T1 t1, T2 t2, T3 t3,
			T4 t4, T5 t5) {
		return new Tuple5<>(t1, t2, t3, t4, t5);
	}

	public static <T1, T2, T3, T4, T5, T6> Tuple6<T1, T2, T3, T4, T5, T6> of(T1 t1, T2 t2,
			T3 t3, T4 t4, T5 t5, T6 t6) {
		return new Tuple6<>(t1, t2, t3, t4, t5, t6);
	}

	/**
	 * Append a value to a {@link Tuple2}, used when folding a binary combination into a
	 * wider one.
	 */
	public static <T1, T2, T3> Tuple3<T1, T2, T3> append(Tuple2<T1, T2> tuple, T3 t3) {
		return new Tuple3<>(tuple.t1, tuple.t2, t3);
	}

	public static <T1, T2, T3, T4> Tuple4<T1, T2, T3, T4> append(Tuple3<T1, T2, T3> tuple, T4 t4) {
		return new Tuple4<>(tuple.t1, tuple.t2, tuple.t3, t4);
	}

	public static <T1, T2, T3, T4, T5> Tuple5<T1, T2, T3, T4, T5> append(
			Tuple4<T1, T2, T3, T4> tuple, T5 t5) {
		return new Tuple5<>(tuple.t1, tuple.t2, tuple.t3, tuple.t4, t5);
	}

	public static <T1, T2, T3, T4, T5, T6> Tuple6<T1, T2, T3, T4, T5, T6> append(
			Tuple5<T1, T2, T3, T4, T5> tuple, T6 t6) {
		return new Tuple6<>(tuple.t1, tuple.t2, tuple.t3, tuple.t4, tuple.t5, t6);
	}

	Tuples() {
	}
}
