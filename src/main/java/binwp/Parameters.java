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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import binwp.core.Environment;
import binwp.tasks.FunctionSpecs;

/**
 * The options of an analysis. Options which only make sense when comparing two
 * programs are rejected by <code>validate()</code> when only one is given.
 */
public class Parameters {
	public static final List<String> DEBUG_OPTIONS = Collections.unmodifiableList(
			Arrays.asList("z3-solver-stats", "z3-verbose", "constraint-stats", "eval-constraint-stats"));

	public static final List<String> SHOW_OPTIONS = Collections
			.unmodifiableList(Arrays.asList("bir", "refuted-goals", "paths", "precond-internal", "precond-smtlib"));

	/**
	 * Name of the function to analyse.
	 */
	private String func = "";
	/**
	 * SMT-LIB2 hypothesis on the initial state.
	 */
	private String precond = "";
	/**
	 * SMT-LIB2 postcondition on the final state.
	 */
	private String postcond = "";
	private boolean tripAsserts;
	private boolean checkNullDerefs;
	private boolean checkInvalidDerefs;
	private boolean compareFuncCalls;
	private List<String> comparePostRegValues = Collections.emptyList();
	private List<String> pointerRegList = Collections.emptyList();
	/**
	 * Regular expression selecting the subroutines to inline, or
	 * <code>null</code>.
	 */
	private String inline;
	private int numUnroll = 5;
	private boolean useFunInputRegs = true;
	/**
	 * Constant address difference between the original and modified data, or
	 * <code>null</code>.
	 */
	private BigInteger memOffset;
	private boolean rewriteAddresses;
	private BigInteger stackBase;
	private BigInteger stackSize;
	private BigInteger heapBase;
	private BigInteger heapSize;
	private List<String> show = Collections.emptyList();
	private List<String> debug = Collections.emptyList();
	private List<String> funSpecs = Collections.emptyList();
	private final List<UserFuncSpec> userFuncSpecs = new ArrayList<>();
	private int timeout;

	public String getFunc() {
		return func;
	}

	public Parameters setFunc(String func) {
		this.func = func;
		return this;
	}

	public String getPrecond() {
		return precond;
	}

	public Parameters setPrecond(String precond) {
		this.precond = precond;
		return this;
	}

	public String getPostcond() {
		return postcond;
	}

	public Parameters setPostcond(String postcond) {
		this.postcond = postcond;
		return this;
	}

	public boolean getTripAsserts() {
		return tripAsserts;
	}

	/**
	 * Treat any reachable call to an assertion failure function as a violation.
	 *
	 * @param flag
	 * @return
	 */
	public Parameters setTripAsserts(boolean flag) {
		this.tripAsserts = flag;
		return this;
	}

	public boolean getCheckNullDerefs() {
		return checkNullDerefs;
	}

	public Parameters setCheckNullDerefs(boolean flag) {
		this.checkNullDerefs = flag;
		return this;
	}

	public boolean getCheckInvalidDerefs() {
		return checkInvalidDerefs;
	}

	public Parameters setCheckInvalidDerefs(boolean flag) {
		this.checkInvalidDerefs = flag;
		return this;
	}

	public boolean getCompareFuncCalls() {
		return compareFuncCalls;
	}

	public Parameters setCompareFuncCalls(boolean flag) {
		this.compareFuncCalls = flag;
		return this;
	}

	public List<String> getComparePostRegValues() {
		return comparePostRegValues;
	}

	public Parameters setComparePostRegValues(List<String> regs) {
		this.comparePostRegValues = regs;
		return this;
	}

	public List<String> getPointerRegList() {
		return pointerRegList;
	}

	public Parameters setPointerRegList(List<String> regs) {
		this.pointerRegList = regs;
		return this;
	}

	public String getInline() {
		return inline;
	}

	public Parameters setInline(String regex) {
		this.inline = regex;
		return this;
	}

	public int getNumUnroll() {
		return numUnroll;
	}

	public Parameters setNumUnroll(int numUnroll) {
		this.numUnroll = numUnroll;
		return this;
	}

	public boolean getUseFunInputRegs() {
		return useFunInputRegs;
	}

	public Parameters setUseFunInputRegs(boolean flag) {
		this.useFunInputRegs = flag;
		return this;
	}

	public BigInteger getMemOffset() {
		return memOffset;
	}

	public Parameters setMemOffset(BigInteger offset) {
		this.memOffset = offset;
		return this;
	}

	public boolean getRewriteAddresses() {
		return rewriteAddresses;
	}

	public Parameters setRewriteAddresses(boolean flag) {
		this.rewriteAddresses = flag;
		return this;
	}

	public Parameters setStack(BigInteger base, BigInteger size) {
		this.stackBase = base;
		this.stackSize = size;
		return this;
	}

	public Parameters setHeap(BigInteger base, BigInteger size) {
		this.heapBase = base;
		this.heapSize = size;
		return this;
	}

	/**
	 * Get the stack region. The stack grows down from its base, so the region
	 * covers <code>size</code> bytes ending at the base.
	 *
	 * @return
	 */
	public Environment.Range getStackRange() {
		if (stackBase == null && stackSize == null) {
			return Environment.DEFAULT_STACK;
		}
		BigInteger high = stackBase != null ? stackBase : Environment.DEFAULT_STACK.getHigh();
		BigInteger size = stackSize != null ? stackSize
				: Environment.DEFAULT_STACK.getHigh().subtract(Environment.DEFAULT_STACK.getLow()).add(BigInteger.ONE);
		return new Environment.Range(high.subtract(size).add(BigInteger.ONE), high);
	}

	/**
	 * Get the heap region, which covers <code>size</code> bytes from its base.
	 *
	 * @return
	 */
	public Environment.Range getHeapRange() {
		if (heapBase == null && heapSize == null) {
			return Environment.DEFAULT_HEAP;
		}
		BigInteger low = heapBase != null ? heapBase : Environment.DEFAULT_HEAP.getLow();
		BigInteger size = heapSize != null ? heapSize
				: Environment.DEFAULT_HEAP.getHigh().subtract(Environment.DEFAULT_HEAP.getLow()).add(BigInteger.ONE);
		return new Environment.Range(low, low.add(size).subtract(BigInteger.ONE));
	}

	public List<String> getShow() {
		return show;
	}

	public boolean isShown(String option) {
		return show.contains(option);
	}

	public Parameters setShow(List<String> show) {
		this.show = show;
		return this;
	}

	public List<String> getDebug() {
		return debug;
	}

	public boolean isDebug(String option) {
		return debug.contains(option);
	}

	public Parameters setDebug(List<String> debug) {
		this.debug = debug;
		return this;
	}

	public List<String> getFunSpecs() {
		return funSpecs;
	}

	/**
	 * Set the function specs to use by name, in order. An empty list selects the
	 * defaults.
	 *
	 * @param specs
	 * @return
	 */
	public Parameters setFunSpecs(List<String> specs) {
		this.funSpecs = specs;
		return this;
	}

	public List<UserFuncSpec> getUserFuncSpecs() {
		return userFuncSpecs;
	}

	public Parameters addUserFuncSpec(String name, String pre, String post) {
		userFuncSpecs.add(new UserFuncSpec(name, pre, post));
		return this;
	}

	public int getTimeout() {
		return timeout;
	}

	/**
	 * Limit each solver check to a number of milliseconds, or zero for no limit.
	 *
	 * @param millis
	 * @return
	 */
	public Parameters setTimeout(int millis) {
		this.timeout = millis;
		return this;
	}

	/**
	 * Check these options are consistent for a given number of programs.
	 *
	 * @param programCount
	 * @throws ConfigurationException
	 */
	public void validate(int programCount) {
		if (func == null || func.isEmpty()) {
			throw new ConfigurationException("no function to analyse");
		} else if (programCount != 1 && programCount != 2) {
			throw new ConfigurationException("expected one or two programs, got " + programCount);
		} else if (programCount == 1) {
			if (compareFuncCalls) {
				throw new ConfigurationException("compareFuncCalls requires two programs");
			} else if (checkInvalidDerefs) {
				throw new ConfigurationException("checkInvalidDerefs requires two programs");
			} else if (!comparePostRegValues.isEmpty()) {
				throw new ConfigurationException("comparePostRegValues requires two programs");
			} else if (memOffset != null) {
				throw new ConfigurationException("memOffset requires two programs");
			} else if (rewriteAddresses) {
				throw new ConfigurationException("rewriteAddresses requires two programs");
			}
		}
		if (memOffset != null && rewriteAddresses) {
			throw new ConfigurationException("memOffset and rewriteAddresses cannot be used together");
		} else if (numUnroll < 0) {
			throw new ConfigurationException("numUnroll must be non-negative, got " + numUnroll);
		}
		for (String d : debug) {
			if (!DEBUG_OPTIONS.contains(d)) {
				throw new ConfigurationException("invalid debug option " + d + ", expected one of " + DEBUG_OPTIONS);
			}
		}
		for (String s : show) {
			if (!SHOW_OPTIONS.contains(s)) {
				throw new ConfigurationException("invalid show option " + s + ", expected one of " + SHOW_OPTIONS);
			}
		}
		for (String f : funSpecs) {
			if (!FunctionSpecs.isKnown(f)) {
				throw new ConfigurationException("unknown function spec " + f);
			}
		}
	}

	/**
	 * A user-supplied spec for a named function.
	 */
	public static final class UserFuncSpec {
		private final String name;
		private final String pre;
		private final String post;

		public UserFuncSpec(String name, String pre, String post) {
			this.name = name;
			this.pre = pre;
			this.post = post;
		}

		public String getName() {
			return name;
		}

		public String getPre() {
			return pre;
		}

		public String getPost() {
			return post;
		}
	}
}
