package org.chagres.bridge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** No single applicable constructor or method exists for a name and marshaled argument types. */
public final class MethodNotFoundException extends BridgeException {
  private final String memberName;
  private final List<String> argTypes;

  public MethodNotFoundException(String memberName, Class<?>[] argTypes, String detail) {
    super(ErrorKind.METHOD_NOT_FOUND, format(memberName, argTypes, detail));
    this.memberName = memberName;
    List<String> names = new ArrayList<>(argTypes.length);
    for (Class<?> t : argTypes) {
      names.add(t.getName());
    }
    this.argTypes = Collections.unmodifiableList(names);
  }

  public String memberName() {
    return memberName;
  }

  /** Fully qualified names of the marshaled argument types, in call order. */
  public List<String> argTypes() {
    return argTypes;
  }

  private static String format(String memberName, Class<?>[] argTypes, String detail) {
    StringBuilder sb = new StringBuilder(detail).append(": ").append(memberName).append("(");
    for (int i = 0; i < argTypes.length; i++) {
      if (i > 0) sb.append(", ");
      sb.append(argTypes[i].getTypeName());
    }
    return sb.append(")").toString();
  }
}
