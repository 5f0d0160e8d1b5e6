package schedc.ir;

import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Bottom-up rewriting and traversal of control trees.
 * Children of dynamic nodes are replaced in place; static nodes are passed to the function as a whole and not descended into.
 */
public class ControlRewriter {
  /**
   * Rewrites the children of {@code control} first, then {@code control} itself.
   * @return the replacement of {@code control} (possibly {@code control} itself)
   */
  public static Control rewrite(Control control, UnaryOperator<Control> fn) {
    if (control instanceof Control.Seq) {
      ((Control.Seq)control).stmts().replaceAll(c -> rewrite(c, fn));
    } else if (control instanceof Control.Par) {
      ((Control.Par)control).stmts().replaceAll(c -> rewrite(c, fn));
    } else if (control instanceof Control.If) {
      var ifc = (Control.If)control;
      ifc.setTbranch(rewrite(ifc.tbranch(), fn));
      ifc.setFbranch(rewrite(ifc.fbranch(), fn));
    } else if (control instanceof Control.While) {
      var wc = (Control.While)control;
      wc.setBody(rewrite(wc.body(), fn));
    } else if (control instanceof Control.Repeat) {
      var rc = (Control.Repeat)control;
      rc.setBody(rewrite(rc.body(), fn));
    }
    return fn.apply(control);
  }

  /** Rewrites the whole control program of a component. */
  public static void rewrite(Component comp, UnaryOperator<Control> fn) { comp.setControl(rewrite(comp.control(), fn)); }

  /** Visits all nodes in pre-order, static subtrees included. */
  public static void forEach(Control control, Consumer<Control> action) {
    action.accept(control);
    for (Control child : control.children())
      forEach(child, action);
  }
}
