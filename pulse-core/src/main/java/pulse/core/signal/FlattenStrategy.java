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

package pulse.core.signal;

/**
 * Describes how a producer of producers is joined into a single producer.
 *
 * @see SignalProducer#flatten(SignalProducer, FlattenStrategy)
 */
public enum FlattenStrategy {

	/**
	 * Inner producers are started as soon as they arrive and their values are forwarded
	 * immediately. Completes once the outer producer and every inner producer completed.
	 */
	MERGE("merge"),

	/**
	 * Inner producers are started one after the other, in the order they arrived.
	 * Completes once the outer producer and every inner producer completed.
	 */
	CONCAT("concatenate"),

	/**
	 * Only the latest inner producer is forwarded, earlier ones are disposed of when
	 * a new one arrives. Completes once the outer producer and the latest inner
	 * producer completed.
	 */
	LATEST("latest");

	final String description;

	FlattenStrategy(String description) {
		this.description = description;
	}

	@Override
	public String toString() {
		return description;
	}
}
