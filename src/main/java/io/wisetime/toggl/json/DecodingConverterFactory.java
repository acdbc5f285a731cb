/*
 * Copyright (c) 2020 Practice Insight Pty Ltd. All Rights Reserved.
 */

package io.wisetime.toggl.json;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.wisetime.toggl.util.TogglDecodeException;
import java.io.IOException;
import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.util.function.BooleanSupplier;
import okhttp3.RequestBody;
import okhttp3.ResponseBody;
import retrofit2.Converter;
import retrofit2.Retrofit;
import retrofit2.converter.gson.GsonConverterFactory;

/**
 * Retrofit converter factory which decodes bodies with Gson and reports shape mismatches as
 * {@link TogglDecodeException}.
 *
 * <p>When verbose diagnostics are on, the exception message also carries the beginning of the offending payload.
 */
public final class DecodingConverterFactory extends Converter.Factory {

  static final int SNIPPET_LENGTH = 200;

  private final GsonConverterFactory gsonConverterFactory;
  private final BooleanSupplier includePayload;

  private DecodingConverterFactory(Gson gson, BooleanSupplier includePayload) {
    this.gsonConverterFactory = GsonConverterFactory.create(gson);
    this.includePayload = includePayload;
  }

  public static DecodingConverterFactory create(Gson gson, BooleanSupplier includePayload) {
    return new DecodingConverterFactory(gson, includePayload);
  }

  @Override
  public Converter<ResponseBody, ?> responseBodyConverter(Type type, Annotation[] annotations, Retrofit retrofit) {
    Converter<ResponseBody, ?> delegate = gsonConverterFactory.responseBodyConverter(type, annotations, retrofit);
    return body -> {
      final String payload;
      try (ResponseBody closeable = body) {
        payload = closeable.string();
      }
      if (payload.isEmpty()) {
        return null;
      }
      try {
        return delegate.convert(ResponseBody.create(payload, body.contentType()));
      } catch (JsonParseException | IllegalStateException | IOException e) {
        // the payload is already in memory, so an IOException here is malformed JSON
        throw new TogglDecodeException(describe(type, payload, e.getMessage()), e);
      } catch (TogglDecodeException e) {
        throw new TogglDecodeException(describe(type, payload, e.getMessage()), e);
      }
    };
  }

  @Override
  public Converter<?, RequestBody> requestBodyConverter(Type type, Annotation[] parameterAnnotations,
                                                        Annotation[] methodAnnotations, Retrofit retrofit) {
    return gsonConverterFactory.requestBodyConverter(type, parameterAnnotations, methodAnnotations, retrofit);
  }

  private String describe(Type type, String payload, String reason) {
    String message = "Unable to decode " + type.getTypeName() + ": " + reason;
    if (!includePayload.getAsBoolean()) {
      return message;
    }
    String snippet = payload.length() > SNIPPET_LENGTH ? payload.substring(0, SNIPPET_LENGTH) + "..." : payload;
    return message + " Payload: " + snippet;
  }
}
