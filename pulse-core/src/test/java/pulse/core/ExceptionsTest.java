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

package pulse.core;

import java.io.IOException;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

public class ExceptionsTest {

	@Test
	public void failWithRejectedIsSingleton() {
		assertThat(Exceptions.failWithRejected())
				.isSameAs(Exceptions.failWithRejected())
				.isNotSameAs(Exceptions.failWithRejectedNotTimeCapable())
				.hasMessage("Scheduler unavailable");
	}

	@Test
	public void failWithRejectedNotTimeCapableIsSingleton() {
		assertThat(Exceptions.failWithRejectedNotTimeCapable())
				.isSameAs(Exceptions.failWithRejectedNotTimeCapable())
				.isNotSameAs(Exceptions.failWithRejected())
				.hasMessage("Scheduler is not capable of time-based scheduling");
	}

	@Test
	public void propagateDoesntWrapRuntimeException() {
		IllegalStateException ex = new IllegalStateException("boom");

		assertThat(Exceptions.propagate(ex)).isSameAs(ex);
	}

	@Test
	public void propagateWrapsCheckedExceptionAndUnwrapRecoversIt() {
		IOException ex = new IOException("boom");
		RuntimeException propagated = Exceptions.propagate(ex);

		assertThat(propagated).hasCause(ex);
		assertThat(Exceptions.unwrap(propagated)).isSameAs(ex);
	}

	@Test
	public void throwIfFatalThrowsLinkageError() {
		assertThatExceptionOfType(LinkageError.class)
				.isThrownBy(() -> Exceptions.throwIfFatal(new LinkageError("fatal")));
	}

	@Test
	public void throwIfFatalIgnoresRegularExceptions() {
		Exceptions.throwIfFatal(new IllegalArgumentException("not fatal"));
	}

	@Test
	public void multipleCanBeUnwrapped() {
		IllegalStateException first = new IllegalStateException("first");
		IllegalArgumentException second = new IllegalArgumentException("second");
		RuntimeException multiple = Exceptions.multiple(Arrays.asList(first, second));

		assertThat(Exceptions.isMultiple(multiple)).isTrue();
		assertThat(Exceptions.unwrapMultiple(multiple)).containsExactly(first, second);
		assertThat(Exceptions.unwrapMultiple(first)).containsExactly(first);
	}
}
