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

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * A tuple that holds two non-null values.
 * <p>
 * Larger tuples extend this class, so a {@code Tuple3} is also a {@code Tuple2} of its
 * first two values.
 *
 * @param <T1> The type of the first non-null value held by this tuple
 * @param <T2> The type of the second non-null value held by this tuple
 */
public class Tuple2<T1, T2> implements Iterable<Object>, Serializable {

	private static final long serialVersionUID = -3518082018884860684L;

	final T1 t1;
	final T2 t2;

	Tuple2(T1 t1, T2 t2) {
		this.t1 = Objects.requireNonNull(t1, "t1");
		this.t2 = Objects.requireNonNull(t2, "t2");
	}

	public T1 getT1() {
		return t1;
	}

	public T2 getT2() {
		return t2;
	}

	/**
	 * Turn this {@code Tuple} into a plain {@code Object[]}, in order.
	 *
	 * @return A new Object array that wraps the elements of this {@code Tuple}.
	 */
	public Object[] toArray() {
		return new Object[]{t1, t2};
	}

	/**
	 * Turn this {@code Tuple} into an unmodifiable {@link List}, in order.
	 *
	 * @return A new List that wraps the elements of this {@code Tuple}.
	 */
	public List<Object> toList() {
		return Collections.unmodifiableList(Arrays.asList(toArray()));
	}

	/**
	 * Return the number of elements in this {@literal Tuples}.
	 *
	 * @return The size of this {@literal Tuples}.
	 */
	public int size() {
		return 2;
	}

	@Override
	public Iterator<Object> iterator() {
		return toList().iterator();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return Arrays.equals(toArray(), ((Tuple2<?, ?>) o).toArray());
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(toArray());
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("[");
		Object[] values = toArray();
		for (int i = 0; i < values.length; i++) {
			if (i > 0) {
				sb.append(',');
			}
			sb.append(values[i]);
		}
		return sb.append(']').toString();
	}
}
