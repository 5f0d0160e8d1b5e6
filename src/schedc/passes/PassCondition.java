package schedc.passes;

/**
 * Properties of the IR that passes establish and rely on.
 */
public enum PassCondition {
  /** The design rule checks passed. */
  WELL_FORMED,
  /** Fixed latencies are annotated as {@code @promotable}. */
  INFERRED,
  /** Every static subtree is a single enable of a static group. */
  STATIC_INLINED,
  /** No reference cells are declared or bound at invokes. */
  NO_REF_CELLS,
  /** No static groups or static control are left. */
  NO_STATIC,
  NO_INVOKE,
  NO_REPEAT,
  /** If and while nodes read their condition without a comb group. */
  NO_COMB_GROUPS,
  /** All control is replaced by state machines. */
  CONTROL_COMPILED
}
