package udplower.pass;

import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import udplower.ast.AstAnd;
import udplower.ast.AstAssign;
import udplower.ast.AstConst;
import udplower.ast.AstEq;
import udplower.ast.AstIf;
import udplower.ast.AstNodeExpr;
import udplower.ast.AstUdpTableLine;
import udplower.ast.AstUdpTableLineVal;
import udplower.ast.AstVarRef;
import udplower.ast.FileLine;
import udplower.diag.Diagnostics;
import udplower.num.BitNumber;

/**
 * Turns one table line into an if statement and appends it to the chain of the current table.
 * <p>
 * For the line {@code x 0 1 : 1} over inputs a, b, c the generated statement is
 * {@code if ((ifield & 3'b110) == 3'b100) q = 1'b1;}. The first line becomes the body of the always block,
 * each later line the else branch of its predecessor, so the first matching line wins.
 */
class RowCompiler {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Diagnostics diag;

  RowCompiler(Diagnostics diag) { this.diag = diag; }

  /**
   * Builds mask and compare values for a line. Position i of the input field is bit i.
   * '0' and '1' are matched; any other symbol ('x', '?', 'b', ...) is a don't-care.
   * Values beyond the width are ignored.
   */
  static MaskCompare buildMaskCompare(List<AstUdpTableLineVal> ifieldVals, int width) {
    BitNumber maskNum = new BitNumber(width);
    BitNumber cmpNum = new BitNumber(width);
    for (int bitIndex = 0; bitIndex < ifieldVals.size() && bitIndex < width; ++bitIndex) {
      switch (ifieldVals.get(bitIndex).getSymbol()) {
      case '0':
        maskNum.setBit(bitIndex, 1);
        cmpNum.setBit(bitIndex, 0);
        break;
      case '1':
        maskNum.setBit(bitIndex, 1);
        cmpNum.setBit(bitIndex, 1);
        break;
      default:
        maskNum.setBit(bitIndex, 0);
        cmpNum.setBit(bitIndex, 0);
        break;
      }
    }
    return new MaskCompare(maskNum, cmpNum);
  }

  /** One bit output value: '0' and '1' as given, anything else is x. */
  static BitNumber outputValue(char symbol) {
    BitNumber onum = new BitNumber(1);
    if (symbol == '0')
      onum.setBit(0, '0');
    else if (symbol == '1')
      onum.setBit(0, '1');
    else
      onum.setBit(0, 'x');
    return onum;
  }

  void compile(AstUdpTableLine nodep, UdpContext ctx) {
    FileLine fl = nodep.getFileline();
    List<AstUdpTableLineVal> ifieldVals = nodep.getIfield();
    List<AstUdpTableLineVal> ofieldVals = nodep.getOfield();
    if (ifieldVals.size() != ctx.inputNum) {
      diag.error(nodep, ctx.inputNum + " input values required, but the table line has " + ifieldVals.size());
    }

    AstNodeExpr condp;
    if (ctx.ifieldVarp != null) {
      MaskCompare maskCmp = buildMaskCompare(ifieldVals, ctx.inputNum);
      logger.trace("UDP. Line at {}: mask {} cmp {}", fl, maskCmp.mask(), maskCmp.cmp());
      condp = new AstEq(fl,
                        new AstAnd(fl, new AstVarRef(fl, ctx.ifieldVarp, AstVarRef.Access.Read), new AstConst(fl, maskCmp.mask())),
                        new AstConst(fl, maskCmp.cmp()));
    } else {
      // Without inputs there is nothing to compare; the line always matches.
      condp = new AstConst(fl, BitNumber.ofLong(1, 1));
    }

    BitNumber onum;
    if (ofieldVals.isEmpty()) {
      diag.error(nodep, "table line has no output value");
      onum = outputValue('x');
    } else {
      if (ofieldVals.size() > 1)
        logger.debug("UDP. Line at {} has {} output values, using the first", fl, ofieldVals.size());
      onum = outputValue(ofieldVals.get(0).getSymbol());
    }

    AstAssign thenStmtp = null;
    if (ctx.ofieldVarp != null)
      thenStmtp = new AstAssign(fl, new AstVarRef(fl, ctx.ofieldVarp, AstVarRef.Access.Write), new AstConst(fl, onum));
    AstIf ifStmtp = new AstIf(fl, condp, thenStmtp);
    if (ctx.lineStmtp == null)
      ctx.alwaysp.addStmt(ifStmtp);
    else
      ctx.lineStmtp.addElses(ifStmtp);
    ctx.lineStmtp = ifStmtp;
  }
}
