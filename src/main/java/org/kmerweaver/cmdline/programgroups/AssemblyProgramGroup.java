package org.kmerweaver.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.kmerweaver.utils.help.HelpConstants;

/**
 * Program group for tools that assemble sequences from k-mers
 */
public class AssemblyProgramGroup implements CommandLineProgramGroup {
    @Override
    public String getName() {
        return HelpConstants.DOC_CAT_ASSEMBLY;
    }

    @Override
    public String getDescription() {
        return HelpConstants.DOC_CAT_ASSEMBLY_SUMMARY;
    }
}
