package com.slpk.core;

import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import com.google.gson.stream.MalformedJsonException;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * 流式JSON格式化，两个空格缩进
 * 
 * 逐个token复制，不在内存中构建整棵树。数字按原始文本输出，不做浮点转换。
 */
public class JsonReformatter {
    
    private static final String INDENT = "  ";
    
    /**
     * 读取一个JSON值并格式化写出
     *
     * @param in UTF-8编码的JSON
     * @param out 格式化结果，不会被关闭
     * @throws IOException 读写失败、JSON格式错误或不是合法的UTF-8
     */
    public static void reformat(InputStream in, OutputStream out) throws IOException {
        // 非法UTF-8直接报错，不替换为U+FFFD
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        JsonReader reader = new JsonReader(new BufferedReader(new InputStreamReader(in, decoder)));
        BufferedWriter sink = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        JsonWriter writer = new JsonWriter(sink);
        writer.setIndent(INDENT);
        writer.setSerializeNulls(true);
        writer.setHtmlSafe(false);
        
        try {
            copyValue(reader, writer);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new MalformedJsonException("JSON值之后还有多余内容");
            }
        } catch (IllegalStateException e) {
            // Gson 对部分结构错误抛出 IllegalStateException
            throw new MalformedJsonException(e.getMessage());
        }
        
        writer.flush();
        sink.write('\n');
        sink.flush();
    }
    
    private static void copyValue(JsonReader reader, JsonWriter writer) throws IOException {
        int depth = 0;
        do {
            JsonToken token = reader.peek();
            switch (token) {
                case BEGIN_OBJECT:
                    reader.beginObject();
                    writer.beginObject();
                    depth++;
                    break;
                case END_OBJECT:
                    reader.endObject();
                    writer.endObject();
                    depth--;
                    break;
                case BEGIN_ARRAY:
                    reader.beginArray();
                    writer.beginArray();
                    depth++;
                    break;
                case END_ARRAY:
                    reader.endArray();
                    writer.endArray();
                    depth--;
                    break;
                case NAME:
                    writer.name(reader.nextName());
                    break;
                case STRING:
                    writer.value(reader.nextString());
                    break;
                case NUMBER:
                    // 保留原始数字文本
                    writer.jsonValue(reader.nextString());
                    break;
                case BOOLEAN:
                    writer.value(reader.nextBoolean());
                    break;
                case NULL:
                    reader.nextNull();
                    writer.nullValue();
                    break;
                case END_DOCUMENT:
                default:
                    throw new MalformedJsonException("JSON内容不完整");
            }
        } while (depth > 0);
    }
}
