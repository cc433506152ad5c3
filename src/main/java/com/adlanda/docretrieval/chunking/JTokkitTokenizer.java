package com.adlanda.docretrieval.chunking;

import com.adlanda.docretrieval.exception.ConfigurationException;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.IntArrayList;

/**
 * BPE tokenizer backed by JTokkit.
 *
 * Defaults to {@code cl100k_base}, the encoding used by the OpenAI embedding models.
 * Special-token markers in the input are encoded as ordinary text.
 */
public class JTokkitTokenizer implements Tokenizer {

    public static final String DEFAULT_ENCODING = "cl100k_base";

    private final Encoding encoding;

    public JTokkitTokenizer() {
        this(DEFAULT_ENCODING);
    }

    public JTokkitTokenizer(String encodingName) {
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        this.encoding = registry.getEncoding(encodingName)
                .orElseThrow(() -> new ConfigurationException("Unknown tokenizer encoding: " + encodingName));
    }

    @Override
    public int[] encode(String text) {
        if (text == null || text.isEmpty()) {
            return new int[0];
        }
        return encoding.encodeOrdinary(text).toArray();
    }

    @Override
    public String decode(int[] tokens) {
        IntArrayList list = new IntArrayList(tokens.length);
        for (int token : tokens) {
            list.add(token);
        }
        return encoding.decode(list);
    }

    public String encodingName() {
        return encoding.getName();
    }
}
