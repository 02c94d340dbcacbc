package org.hoare.base.util.proof;

import org.hoare.base.util.hoare.Triple;
import org.hoare.base.util.hoare.exceptions.RuleException;

/**
 * A deferred application of one of the {@link org.hoare.base.util.hoare.HoareRules}, so that a
 * {@link Proof} only records the result once the rule has accepted its premises.
 */
public interface RuleApplication
{
  public Triple apply() throws RuleException;
}
