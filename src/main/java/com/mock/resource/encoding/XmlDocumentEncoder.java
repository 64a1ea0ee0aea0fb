package com.mock.resource.encoding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.mock.resource.definition.TypeNames;
import com.mock.resource.serialize.Document;

import javax.xml.namespace.QName;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;

/**
 * XML rendering of documents. The document root name becomes the root element;
 * {@value #FALLBACK_ROOT} is used when the root name is unknown.
 *
 * <p>Collections are written as a wrapper element holding one element per member, named
 * after the singular of the wrapper: {@code <books><book>..</book></books>}. The same rule
 * applies to to-many attributes inside records.</p>
 */
public class XmlDocumentEncoder implements DocumentEncoder {

    static final String FALLBACK_ROOT = "records";

    private final XmlMapper xmlMapper;

    public XmlDocumentEncoder() {
        this(new XmlMapper());
    }

    public XmlDocumentEncoder(XmlMapper xmlMapper) {
        this.xmlMapper = xmlMapper;
    }

    @Override
    public String encode(Document document) {
        String rootName = document.rootName() != null ? document.rootName() : FALLBACK_ROOT;
        StringWriter out = new StringWriter();
        try (ToXmlGenerator generator = xmlMapper.getFactory().createGenerator(out)) {
            generator.initGenerator();
            generator.setNextName(new QName(rootName));
            writeValue(generator, rootName, document.content());
        } catch (JsonProcessingException e) {
            throw new DocumentEncodingException("Failed to encode document '" + rootName
                    + "' as XML: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DocumentEncodingException("Failed to encode document '" + rootName
                    + "' as XML: " + e.getMessage(), e);
        }
        return out.toString();
    }

    private void writeValue(ToXmlGenerator generator, String name, Object value) throws IOException {
        if (value == null) {
            generator.writeNull();
        } else if (value instanceof Map<?, ?> map) {
            generator.writeStartObject();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String field = String.valueOf(entry.getKey());
                generator.writeFieldName(field);
                writeValue(generator, field, entry.getValue());
            }
            generator.writeEndObject();
        } else if (value instanceof Collection<?> collection) {
            String element = TypeNames.elementName(name);
            generator.writeStartObject();
            for (Object member : collection) {
                generator.writeFieldName(element);
                writeValue(generator, element, member);
            }
            generator.writeEndObject();
        } else if (value instanceof Integer number) {
            generator.writeNumber(number);
        } else if (value instanceof Long number) {
            generator.writeNumber(number);
        } else if (value instanceof BigDecimal number) {
            generator.writeNumber(number);
        } else if (value instanceof BigInteger number) {
            generator.writeNumber(number);
        } else if (value instanceof Number number) {
            generator.writeNumber(number.doubleValue());
        } else if (value instanceof Boolean flag) {
            generator.writeBoolean(flag);
        } else if (value instanceof CharSequence || value instanceof Character || value instanceof Enum<?>) {
            generator.writeString(value.toString());
        } else {
            xmlMapper.writeValue(generator, value);
        }
    }

    @Override
    public String contentType() {
        return "application/xml";
    }

    @Override
    public String format() {
        return "xml";
    }
}
