package sivantoledo.assimilation.ensemble;

import org.apache.commons.math3.linear.RealMatrix;

/*
 * Scratch state of one analysis step, created by beginAnalysis() and consumed
 * by endAnalysis(). Nothing in here is visible outside the driver until the
 * step ends.
 */
class AnalysisSession {

  final double     time;
  RealMatrix       globalEnsemble; // the analysis in progress, n by N
  final RealMatrix localBuffer;    // concatenated local ensembles, null for global analysis

  /*
   * Accumulated smoother transforms, one per domain or a single one for
   * global analysis; null where nothing was assimilated yet.
   */
  final RealMatrix[] transforms;
  final int[]        observationCounts;

  AnalysisSession(double time, RealMatrix globalEnsemble, RealMatrix localBuffer, int numDomains) {
    this.time              = time;
    this.globalEnsemble    = globalEnsemble;
    this.localBuffer       = localBuffer;
    this.transforms        = new RealMatrix[ Math.max(numDomains, 1) ];
    this.observationCounts = new int[ Math.max(numDomains, 1) ];
  }

  void accumulate(int slot, RealMatrix X5, int observations) {
    transforms[slot] = transforms[slot] == null ? X5 : transforms[slot].multiply(X5);
    observationCounts[slot] += observations;
  }

  int domainsWithObservations() {
    int count = 0;
    for (int c: observationCounts) if (c > 0) count++;
    return count;
  }
}
