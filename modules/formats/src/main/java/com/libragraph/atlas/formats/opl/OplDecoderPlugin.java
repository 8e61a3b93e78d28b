package com.libragraph.atlas.formats.opl;

import com.libragraph.atlas.formats.api.DecoderFactory;
import com.libragraph.atlas.formats.api.DecoderPlugin;
import com.libragraph.atlas.types.FormatId;

public class OplDecoderPlugin implements DecoderPlugin {

    @Override
    public FormatId formatId() {
        return FormatId.OPL;
    }

    @Override
    public DecoderFactory factory() {
        return OplDecoder::new;
    }
}
