/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package net.hydromatic.gams.runtime;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Proxy;
import java.lang.reflect.Type;
import java.text.Format;
import java.text.MessageFormat;
import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Wrapper classes around resources that allow the compiler to check
 * whether a message exists, and that uses of a message have the right
 * number and types of arguments.
 *
 * <p>A resource interface declares one method per message, annotated with
 * {@link BaseMessage}. {@link #create(Class)} returns a dynamic proxy that
 * implements the interface; each call returns an {@link Inst} (or an
 * {@link ExInst}, which can also build an exception) carrying the
 * arguments. The text comes from a {@code .properties} file named after
 * the interface, falling back to the base message.
 */
public class Resources {
  private Resources() {}

  /** Creates an instance of the resource object, using the interface's
   * name as the name of the resource file.
   *
   * @param <T> Resource type
   * @param clazz Interface that contains a method for each resource
   * @return Instance of the interface that can be used to instantiate
   * resources
   */
  public static <T> T create(Class<T> clazz) {
    return create(requireNonNull(clazz.getCanonicalName()), clazz);
  }

  /** Creates an instance of the resource object backed by the resource
   * bundle {@code base}. */
  public static <T> T create(final String base, Class<T> clazz) {
    final Map<String, Object> cache = new ConcurrentHashMap<>();
    //noinspection unchecked
    return (T) Proxy.newProxyInstance(clazz.getClassLoader(),
        new Class[] {clazz},
        (proxy, method, args) -> {
          if (method.getName().equals("toString")
              && method.getParameterCount() == 0) {
            return "Resources(" + base + ")";
          }
          if (args == null || args.length == 0) {
            return cache.computeIfAbsent(method.getName(),
                name -> instantiate(base, method, new Object[0]));
          }
          return instantiate(base, method, args);
        });
  }

  private static Object instantiate(String base, Method method,
      @Nullable Object[] args) {
    final Class<?> returnType = method.getReturnType();
    try {
      final Constructor<?> constructor =
          returnType.getConstructor(String.class, Locale.class,
              Method.class, Object[].class);
      return constructor.newInstance(base, Locale.ROOT, method, args);
    } catch (InvocationTargetException e) {
      final Throwable e2 = e.getTargetException();
      if (e2 instanceof RuntimeException) {
        throw (RuntimeException) e2;
      }
      if (e2 instanceof Error) {
        throw (Error) e2;
      }
      throw new IllegalStateException(e2);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("resource method " + method
          + " must return Inst or a sub-class", e);
    }
  }

  /** Applies all validations to all resource methods in the given
   * resource object.
   *
   * @param o Resource object to validate
   */
  public static void validate(Object o) {
    validate(o, EnumSet.allOf(Validation.class));
  }

  /** Applies the given validations to all resource methods in the given
   * resource object.
   *
   * @param o Resource object to validate
   * @param validations Validations to perform
   */
  public static void validate(Object o, EnumSet<Validation> validations) {
    int count = 0;
    for (Method method : o.getClass().getMethods()) {
      if (!Modifier.isStatic(method.getModifiers())
          && Inst.class.isAssignableFrom(method.getReturnType())) {
        ++count;
        final Class<?>[] parameterTypes = method.getParameterTypes();
        @Nullable Object[] args = new Object[parameterTypes.length];
        for (int i = 0; i < parameterTypes.length; i++) {
          args[i] = zero(parameterTypes[i]);
        }
        try {
          Inst inst = (Inst) method.invoke(o, args);
          if (inst == null) {
            throw new AssertionError("got null from " + method);
          }
          inst.validate(validations);
        } catch (IllegalAccessException e) {
          throw new RuntimeException("in " + method, e);
        } catch (InvocationTargetException e) {
          throw new RuntimeException("in " + method, e.getCause());
        }
      }
    }
    if (count == 0 && validations.contains(Validation.AT_LEAST_ONE)) {
      throw new AssertionError("resource object " + o
          + " contains no resources");
    }
  }

  private static @Nullable Object zero(Class<?> clazz) {
    return clazz == String.class ? ""
        : clazz == int.class ? 0
        : clazz == long.class ? 0L
        : clazz == double.class ? 0D
        : clazz == boolean.class ? false
        : null;
  }

  /** Resource instance. It contains the resource method (which
   * serves to identify the resource), the locale with which we
   * expect to render the resource, and any arguments. */
  public static class Inst {
    protected final Method method;
    protected final String key;
    protected final String base;
    protected final Locale locale;
    protected final @Nullable Object[] args;

    public Inst(String base, Locale locale, Method method,
        @Nullable Object... args) {
      this.method = method;
      this.base = base;
      this.locale = locale;
      this.args = args;
      final Resource resource = method.getAnnotation(Resource.class);
      final String name = method.getName();
      this.key = resource != null
          ? resource.value()
          : Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    @Override public boolean equals(@Nullable Object obj) {
      return this == obj
          || obj != null
          && obj.getClass() == this.getClass()
          && locale.equals(((Inst) obj).locale)
          && method.equals(((Inst) obj).method)
          && Arrays.equals(args, ((Inst) obj).args);
    }

    @Override public int hashCode() {
      return Arrays.asList(locale, method, Arrays.asList(args)).hashCode();
    }

    @Override public String toString() {
      return str();
    }

    public ResourceBundle bundle() {
      return ResourceBundle.getBundle(base, locale);
    }

    public void validate(EnumSet<Validation> validations) {
      for (Validation validation : validations) {
        switch (validation) {
        case BUNDLE_HAS_RESOURCE:
          final ResourceBundle bundle = bundle();
          if (!bundle.containsKey(key)) {
            throw new AssertionError("key '" + key
                + "' not found for resource '" + method.getName()
                + "'; add the following line to " + base + ".properties:\n"
                + key + '=' + baseMessage() + "\n");
          }
          break;
        case MESSAGE_SPECIFIED:
          if (method.getAnnotation(BaseMessage.class) == null) {
            throw new AssertionError("resource '" + method.getName()
                + "' must specify BaseMessage");
          }
          break;
        case EVEN_QUOTES:
          if (countQuotesIn(baseMessage()) % 2 == 1) {
            throw new AssertionError("resource '" + method.getName()
                + "' should have even number of quotes");
          }
          break;
        case MESSAGE_MATCH:
          final String value2 = bundle().containsKey(key)
              ? bundle().getString(key)
              : null;
          if (!baseMessage().equals(value2)) {
            throw new AssertionError("message for resource '"
                + method.getName()
                + "' is different between class and resource file");
          }
          break;
        case ARGUMENT_MATCH:
          final MessageFormat format = new MessageFormat(raw());
          final @Nullable Format[] formats = format.getFormatsByArgumentIndex();
          final List<Class<?>> types = new ArrayList<>();
          final Class<?>[] parameterTypes = method.getParameterTypes();
          for (int i = 0; i < formats.length; i++) {
            types.add(formats[i] instanceof NumberFormat
                ? parameterTypes[i]
                : String.class);
          }
          if (!types.equals(Arrays.asList(parameterTypes))) {
            throw new AssertionError("type mismatch in method '"
                + method.getName() + "' between message format elements "
                + types + " and method parameters "
                + Arrays.asList(parameterTypes));
          }
          break;
        default:
          break;
        }
      }
    }

    private static int countQuotesIn(String message) {
      int count = 0;
      for (int i = 0, n = message.length(); i < n; i++) {
        if (message.charAt(i) == '\'') {
          ++count;
        }
      }
      return count;
    }

    private String baseMessage() {
      return requireNonNull(method.getAnnotation(BaseMessage.class),
          () -> "@BaseMessage is missing for resource '"
              + method.getName() + "'").value();
    }

    /** Returns the message with its arguments substituted. */
    public String str() {
      MessageFormat format = new MessageFormat(raw());
      format.setLocale(locale);
      return format.format(args);
    }

    /** Returns the message pattern, from the bundle if it has one. */
    public String raw() {
      try {
        return bundle().getString(key);
      } catch (MissingResourceException e) {
        // No bundle, or no entry in it. Fall back to the base message.
        return baseMessage();
      }
    }
  }

  /** Sub-class of {@link Inst} that can throw an exception. */
  public static class ExInstWithCause<T extends Exception> extends Inst {
    public ExInstWithCause(String base, Locale locale, Method method,
        @Nullable Object... args) {
      super(base, locale, method, args);
    }

    public T ex(@Nullable Throwable cause) {
      final Class<T> exceptionClass =
          getExceptionClass(method.getGenericReturnType());
      try {
        final Constructor<T> constructor =
            exceptionClass.getConstructor(String.class, Throwable.class);
        return constructor.newInstance(str(), cause);
      } catch (InstantiationException | IllegalAccessException
          | NoSuchMethodException e) {
        throw new RuntimeException(e);
      } catch (InvocationTargetException e) {
        if (e.getCause() instanceof Error) {
          throw (Error) e.getCause();
        } else if (e.getCause() instanceof RuntimeException) {
          throw (RuntimeException) e.getCause();
        } else {
          throw new RuntimeException(e);
        }
      }
    }

    @SuppressWarnings("unchecked")
    static <T> Class<T> getExceptionClass(Type type) {
      // Exception type is the type argument of ExInstWithCause, or of the
      // nearest generic super-class.
      final Type type0 = type;
      for (;;) {
        if (type instanceof ParameterizedType) {
          final Type[] types =
              ((ParameterizedType) type).getActualTypeArguments();
          if (types.length >= 1
              && types[0] instanceof Class
              && Throwable.class.isAssignableFrom((Class<?>) types[0])) {
            return (Class<T>) types[0];
          }
          throw new IllegalStateException(
              "Unable to find superclass ExInstWithCause for " + type);
        }
        if (!(type instanceof Class)) {
          throw new IllegalStateException(
              "Unable to find superclass ExInstWithCause for " + type0);
        }
        final Type superclass = ((Class<?>) type).getGenericSuperclass();
        if (superclass == null) {
          throw new IllegalStateException(
              "Unable to find superclass ExInstWithCause for " + type0);
        }
        type = superclass;
      }
    }

    @Override public void validate(EnumSet<Validation> validations) {
      super.validate(validations);
      if (validations.contains(Validation.CREATE_EXCEPTION)) {
        try {
          ex(new NullPointerException("test"));
        } catch (RuntimeException e) {
          throw new AssertionError(
              "error instantiating exception for resource '"
                  + method.getName() + "'", e);
        }
      }
    }
  }

  /** Sub-class of {@link Inst} that can throw an exception without a
   * cause. */
  public static class ExInst<T extends Exception> extends ExInstWithCause<T> {
    public ExInst(String base, Locale locale, Method method,
        @Nullable Object... args) {
      super(base, locale, method, args);
    }

    public T ex() {
      return ex(null);
    }
  }

  /** Types of validation that can be performed on a resource. */
  public enum Validation {
    /** Checks that each method's resource key corresponds to a resource in
     * the bundle. */
    BUNDLE_HAS_RESOURCE,

    /** Checks that there is at least one resource in the bundle. */
    AT_LEAST_ONE,

    /** Checks that the base message annotation is on every resource. */
    MESSAGE_SPECIFIED,

    /** Checks that every message contains even number of quotes. */
    EVEN_QUOTES,

    /** Checks that the base message matches the message in the bundle. */
    MESSAGE_MATCH,

    /** Checks that it is possible to create an exception. */
    CREATE_EXCEPTION,

    /** Checks that the parameters of the method are consistent with the
     * format elements in the base message. */
    ARGUMENT_MATCH,
  }

  /** The message in the default locale. */
  @Retention(RetentionPolicy.RUNTIME)
  @Target(ElementType.METHOD)
  public @interface BaseMessage {
    String value();
  }

  /** The name of the property in the resource file. */
  @Retention(RetentionPolicy.RUNTIME)
  @Target(ElementType.METHOD)
  public @interface Resource {
    String value();
  }
}
