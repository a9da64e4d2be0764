package dev.pekelund.finsight.documents.extraction;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import dev.pekelund.finsight.documents.support.Amounts;
import java.io.IOException;
import java.math.BigDecimal;

/**
 * Accepts amounts the oracle formats as strings ({@code "$1,200.00"}) as well as plain JSON numbers. Strings without
 * a number become {@code null}.
 */
class LenientAmountDeserializer extends StdScalarDeserializer<BigDecimal> {

    LenientAmountDeserializer() {
        super(BigDecimal.class);
    }

    @Override
    public BigDecimal deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
            return parser.getDecimalValue();
        }
        if (token == JsonToken.VALUE_STRING) {
            return Amounts.parse(parser.getText()).orElse(null);
        }
        if (token == JsonToken.VALUE_NULL) {
            return null;
        }
        return (BigDecimal) context.handleUnexpectedToken(BigDecimal.class, parser);
    }
}
