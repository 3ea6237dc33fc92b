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
package binwp.tasks;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import binwp.core.Constraint;
import binwp.core.Weakening;
import binwp.util.Z3Verifier;

/**
 * The outcome of an analysis.
 */
public class WpResult {
	private final Z3Verifier.Verdict verdict;
	private final Constraint precondition;
	private final Z3Verifier.Counterexample counterexample;
	private final List<Constraint.Goal> refutedGoals;
	private final List<Weakening> weakenings;
	private final Map<String, String> statistics;

	public WpResult(Z3Verifier.Verdict verdict, Constraint precondition, Z3Verifier.Counterexample counterexample,
			List<Constraint.Goal> refutedGoals, List<Weakening> weakenings, Map<String, String> statistics) {
		this.verdict = verdict;
		this.precondition = precondition;
		this.counterexample = counterexample;
		this.refutedGoals = Collections.unmodifiableList(refutedGoals);
		this.weakenings = Collections.unmodifiableList(weakenings);
		this.statistics = Collections.unmodifiableMap(statistics);
	}

	public Z3Verifier.Verdict getVerdict() {
		return verdict;
	}

	public boolean isProved() {
		return verdict == Z3Verifier.Verdict.PROVED;
	}

	/**
	 * The constraint which was checked.
	 *
	 * @return
	 */
	public Constraint getPrecondition() {
		return precondition;
	}

	/**
	 * The initial register values falsifying the precondition, or
	 * <code>null</code> unless the verdict is <code>REFUTED</code>.
	 *
	 * @return
	 */
	public Z3Verifier.Counterexample getCounterexample() {
		return counterexample;
	}

	public List<Constraint.Goal> getRefutedGoals() {
		return refutedGoals;
	}

	/**
	 * The places where the analysis gave up on soundness, of all programs
	 * analysed.
	 *
	 * @return
	 */
	public List<Weakening> getWeakenings() {
		return weakenings;
	}

	public Constraint.Stats getStats() {
		return precondition.getStats();
	}

	public Map<String, String> getSolverStatistics() {
		return statistics;
	}
}
