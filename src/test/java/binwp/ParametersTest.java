// Copyright 2024 The binwp Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package binwp;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import binwp.core.Environment;

public class ParametersTest {

	private static Parameters main() {
		return new Parameters().setFunc("main");
	}

	/**
	 * Parameters which are only meaningful when comparing two programs.
	 */
	private static Stream<Arguments> comparativeOnly() {
		return Stream.of(
				Arguments.of(main().setCompareFuncCalls(true)),
				Arguments.of(main().setCheckInvalidDerefs(true)),
				Arguments.of(main().setComparePostRegValues(List.of("RAX"))),
				Arguments.of(main().setMemOffset(BigInteger.valueOf(0x10))),
				Arguments.of(main().setRewriteAddresses(true)));
	}

	@ParameterizedTest
	@MethodSource("comparativeOnly")
	public void comparativeOptionsNeedTwoPrograms(Parameters params) {
		assertThrows(ConfigurationException.class, () -> params.validate(1));
		params.validate(2);
	}

	/**
	 * Parameters which are invalid however many programs are given.
	 */
	private static Stream<Arguments> invalid() {
		return Stream.of(
				Arguments.of(new Parameters()),
				Arguments.of(main().setMemOffset(BigInteger.ONE).setRewriteAddresses(true)),
				Arguments.of(main().setNumUnroll(-1)),
				Arguments.of(main().setDebug(List.of("z3-everything"))),
				Arguments.of(main().setShow(List.of("everything"))),
				Arguments.of(main().setFunSpecs(List.of("chaos-everything"))));
	}

	@ParameterizedTest
	@MethodSource("invalid")
	public void invalidOptionsAreRejected(Parameters params) {
		assertThrows(ConfigurationException.class, () -> params.validate(1));
		assertThrows(ConfigurationException.class, () -> params.validate(2));
	}

	@Test
	public void programCountIsChecked() {
		assertThrows(ConfigurationException.class, () -> main().validate(0));
		assertThrows(ConfigurationException.class, () -> main().validate(3));
	}

	@Test
	public void validOptionsAreAccepted() {
		Parameters params = main().setCheckNullDerefs(true).setTripAsserts(true).setNumUnroll(0)
				.setShow(List.of("bir", "paths")).setDebug(List.of("constraint-stats"))
				.setFunSpecs(List.of("verifier-assume", "chaos-rax"));
		params.validate(1);
		assertTrue(params.isShown("paths"));
		assertFalse(params.isShown("precond-smtlib"));
		assertTrue(params.isDebug("constraint-stats"));
	}

	@Test
	public void regionsDefaultWhenUnset() {
		assertEquals(Environment.DEFAULT_STACK.getLow(), main().getStackRange().getLow());
		assertEquals(Environment.DEFAULT_HEAP.getHigh(), main().getHeapRange().getHigh());
	}

	@Test
	public void stackGrowsDownFromBase() {
		Environment.Range stack = main().setStack(BigInteger.valueOf(0x2000), BigInteger.valueOf(0x1000))
				.getStackRange();
		assertEquals(BigInteger.valueOf(0x1001), stack.getLow());
		assertEquals(BigInteger.valueOf(0x2000), stack.getHigh());
	}

	@Test
	public void heapGrowsUpFromBase() {
		Environment.Range heap = main().setHeap(BigInteger.valueOf(0x1000), BigInteger.valueOf(0x100))
				.getHeapRange();
		assertEquals(BigInteger.valueOf(0x1000), heap.getLow());
		assertEquals(BigInteger.valueOf(0x10ff), heap.getHigh());
	}
}
