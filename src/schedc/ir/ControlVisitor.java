package schedc.ir;

/**
 * Visitor over all control node kinds. Adding a node kind adds a method here, so every traversal has to handle it.
 */
public interface ControlVisitor<R> {
  R visitEmpty(Control.Empty c);
  R visitEnable(Control.Enable c);
  R visitInvoke(Control.Invoke c);
  R visitSeq(Control.Seq c);
  R visitPar(Control.Par c);
  R visitIf(Control.If c);
  R visitWhile(Control.While c);
  R visitRepeat(Control.Repeat c);

  R visitStaticEnable(StaticControl.StaticEnable c);
  R visitStaticSeq(StaticControl.StaticSeq c);
  R visitStaticPar(StaticControl.StaticPar c);
  R visitStaticIf(StaticControl.StaticIf c);
  R visitStaticRepeat(StaticControl.StaticRepeat c);
  R visitStaticInvoke(StaticControl.StaticInvoke c);
}
