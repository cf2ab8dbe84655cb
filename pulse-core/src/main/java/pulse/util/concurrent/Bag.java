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

package pulse.util.concurrent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * An unordered-removal, insertion-ordered collection. Each insertion hands back a
 * {@link RemovalToken} that is the only way to remove that particular element, so the
 * same value may be inserted several times and removed independently.
 * <p>
 * A bag is not thread-safe: callers guard it with their own lock, or publish immutable
 * {@link #copy() copies} of it.
 *
 * @param <T> the type of the elements
 */
public final class Bag<T> implements Iterable<T> {

	/**
	 * Identifies one element of a {@link Bag}. Tokens are compared by identity.
	 */
	public static final class RemovalToken {

		RemovalToken() {
		}
	}

	final List<RemovalToken> tokens;
	final List<T>            elements;

	public Bag() {
		this.tokens = new ArrayList<>();
		this.elements = new ArrayList<>();
	}

	Bag(Bag<T> source) {
		this.tokens = new ArrayList<>(source.tokens);
		this.elements = new ArrayList<>(source.elements);
	}

	/**
	 * Insert the given value, returning a token that can be used to remove it later.
	 *
	 * @param value the value to insert
	 * @return the token identifying the inserted element
	 */
	public RemovalToken insert(T value) {
		Objects.requireNonNull(value, "value");
		RemovalToken token = new RemovalToken();
		tokens.add(token);
		elements.add(value);
		return token;
	}

	/**
	 * Remove the element that was inserted with the given token, if still present.
	 *
	 * @param token the token returned by {@link #insert(Object)}
	 * @return true if an element was removed
	 */
	public boolean remove(RemovalToken token) {
		// scan from the end, recently inserted elements are removed most often
		for (int i = tokens.size() - 1; i >= 0; i--) {
			if (tokens.get(i) == token) {
				tokens.remove(i);
				elements.remove(i);
				return true;
			}
		}
		return false;
	}

	public int size() {
		return elements.size();
	}

	public boolean isEmpty() {
		return elements.isEmpty();
	}

	/**
	 * @return an independent copy of this bag, sharing the same tokens
	 */
	public Bag<T> copy() {
		return new Bag<>(this);
	}

	@Override
	public Iterator<T> iterator() {
		return Collections.unmodifiableList(elements).iterator();
	}

	@Override
	public String toString() {
		return "Bag" + elements;
	}
}
