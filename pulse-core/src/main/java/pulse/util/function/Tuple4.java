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

import java.util.Objects;

/**
 * A tuple that holds 4 non-null values.
 *
 * @param <T4> The type of the fourth value held by this tuple
 * @see Tuple2
 */
public class Tuple4<T1, T2, T3, T4> extends Tuple3<T1, T2, T3> {

	private static final long serialVersionUID = -5430191584711917813L;

	final T4 t4;

	Tuple4(T1 t1, T2 t2, T3 t3, T4 t4) {
		super(t1, t2, t3);
		this.t4 = Objects.requireNonNull(t4, "t4");
	}

	public T4 getT4() {
		return t4;
	}

	@Override
	public Object[] toArray() {
		return new Object[]{t1, t2, t3, t4};
	}

	@Override
	public int size() {
		return 4;
	}
}
