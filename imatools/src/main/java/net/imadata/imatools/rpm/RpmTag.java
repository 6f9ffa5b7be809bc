package net.imadata.imatools.rpm;

/**
 * Header tags and entry types read by {@link RpmHeaderReader}.
 */
final class RpmTag {
    static final int NAME = 1000;
    static final int VERSION = 1001;
    static final int RELEASE = 1002;
    static final int EPOCH = 1003;
    static final int ARCH = 1022;
    static final int OLDFILENAMES = 1027;
    static final int FILEDIGESTS = 1035;
    static final int SOURCEPACKAGE = 1106;
    static final int DIRINDEXES = 1116;
    static final int BASENAMES = 1117;
    static final int DIRNAMES = 1118;
    static final int FILEDIGESTALGO = 5011;

    static final int TYPE_INT32 = 4;
    static final int TYPE_STRING = 6;
    static final int TYPE_STRING_ARRAY = 8;
    static final int TYPE_I18NSTRING = 9;

    private RpmTag() {
    }
}
