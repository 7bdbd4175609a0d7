package udplower.pass;

import udplower.ast.AstVar;

/** Sorts the ports of the current primitive into inputs and outputs, in declaration order. */
class PortClassifier {
  void classify(AstVar varp, UdpContext ctx) {
    if (ctx.primp == null || !varp.isIO())
      return;
    if (varp.isInput())
      ctx.inputVars.add(varp);
    else
      ctx.outputVars.add(varp);
    if (ctx.inputVars.isEmpty() && ctx.outputVars.size() == 1)
      ctx.firstIsOutput = true;
  }
}
