package org.kmerweaver.utils.help;

public final class HelpConstants {

    private HelpConstants() {};

    /**
     * Definition of the group names / descriptions for documentation/help purposes.
     */
    public final static String DOC_CAT_ASSEMBLY = "Sequence Assembly";
    public final static String DOC_CAT_ASSEMBLY_SUMMARY = "Tools that reconstruct sequences from k-mer collections using de Bruijn graphs";
}
