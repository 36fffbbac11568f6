package org.clinlp.ie.qualifier;

/*
 * This file is part of ClinLP.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * ClinLP is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ClinLP is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ClinLP.  If not, see <https://www.gnu.org/licenses/>.
 */

import org.clinlp.ie.om.Span;

import lombok.Getter;

/**
 * A context rule matched in one sentence, with the scope it reaches after
 * sentence, max_scope and termination limits. Lives for one detection pass.
 */
@Getter
public final class TriggerMatch {

	private final ContextRule rule;
	private final int start;
	private final int end;

	/** Registration order of the rule, last tie-break between triggers. */
	private final int order;

	private int scopeStart;
	private int scopeEnd;

	TriggerMatch(ContextRule rule, int start, int end, int order) {
		this.rule = rule;
		this.start = start;
		this.end = end;
		this.order = order;
		this.scopeStart = start;
		this.scopeEnd = end;
	}

	/** Scope before termination: max_scope tokens, or the whole sentence. */
	void initializeScope(Span sentence) {
		int k = (rule.getMaxScope() != null) ? rule.getMaxScope() : sentence.length();
		int before = Math.max(start - k, sentence.getStart());
		int after = Math.min(end + k, sentence.getEnd());

		switch (rule.getDirection()) {
		case PRECEDING:
			scopeStart = start;
			scopeEnd = after;
			break;
		case FOLLOWING:
			scopeStart = before;
			scopeEnd = end;
			break;
		case BIDIRECTIONAL:
			scopeStart = before;
			scopeEnd = after;
			break;
		default:
			scopeStart = start;
			scopeEnd = end;
		}
	}

	/**
	 * Clips the scope at a termination trigger inside it: the end for triggers
	 * reaching forward, the start for triggers reaching backward.
	 */
	void limitBy(TriggerMatch termination) {
		ContextRuleDirection dir = rule.getDirection();
		if (dir != ContextRuleDirection.FOLLOWING && termination.start >= end && termination.start < scopeEnd) {
			scopeEnd = termination.start;
		}
		if (dir != ContextRuleDirection.PRECEDING && termination.end <= start && termination.end > scopeStart) {
			scopeStart = termination.end;
		}
	}

	boolean overlaps(TriggerMatch other) {
		return start < other.end && other.start < end;
	}

	boolean spanOverlaps(int otherStart, int otherEnd) {
		return start < otherEnd && otherStart < end;
	}

	boolean scopeOverlaps(int otherStart, int otherEnd) {
		return scopeStart < otherEnd && otherStart < scopeEnd;
	}

	boolean spanContains(int otherStart, int otherEnd) {
		return start <= otherStart && otherEnd <= end;
	}

	/** Tokens between this trigger and {@code [otherStart, otherEnd)}; 0 if they touch or overlap. */
	int distanceTo(int otherStart, int otherEnd) {
		return Math.max(0, Math.max(start - otherEnd, otherStart - end));
	}

	@Override
	public String toString() {
		return rule.getQualifier() + " " + rule.getDirection() + " [" + start + ":" + end + "] scope [" + scopeStart
				+ ":" + scopeEnd + ")";
	}
}
