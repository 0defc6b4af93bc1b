package org.chagres.bridge.observability;

import jdk.jfr.*;

/**
 * JFR (Java Flight Recorder) events for profiling and diagnostics.
 *
 * <p>These events integrate with JFR tooling (JDK Mission Control, async-profiler, etc.) to give
 * visibility into bridge traffic without code changes.
 *
 * <p>Enable with: -XX:StartFlightRecording=filename=chagres.jfr,settings=profile
 */
public class BridgeEvents {

  private static final String CATEGORY = "Chagres";

  /** One boundary-crossing operation, from marshaling to the returned handle. */
  @Name("org.chagres.Invocation")
  @Label("Invocation")
  @Category(CATEGORY)
  @Description("A host call into the managed runtime")
  @StackTrace(false)
  public static class InvocationEvent extends Event {
    @Label("Runtime ID")
    public long runtimeId;

    @Label("Invocation ID")
    public long invocationId;

    @Label("Operation")
    public String operation;

    @Label("Target")
    public String target;

    @Label("Success")
    public boolean success;

    @Label("Error Kind")
    public String errorKind;
  }

  @Name("org.chagres.MethodResolution")
  @Label("Method Resolution")
  @Category(CATEGORY)
  @Description("Overload resolution decision")
  @StackTrace(false)
  public static class MethodResolutionEvent extends Event {
    @Label("Class")
    public String className;

    @Label("Member Name")
    public String memberName;

    @Label("Candidate Count")
    public int candidateCount;

    @Label("Chosen Member")
    public String chosenMember;

    @Label("Phase")
    public int phase;

    @Label("Argument Types")
    public String argumentTypes;
  }

  @Name("org.chagres.Reference")
  @Label("Reference")
  @Category(CATEGORY)
  @Description("Managed reference added to or removed from the reference table")
  @StackTrace(false)
  public static class ReferenceEvent extends Event {
    @Label("Runtime ID")
    public long runtimeId;

    @Label("Token")
    public long token;

    @Label("Operation")
    public String operation; // "add" or "release"

    @Label("Object Type")
    public String objectType;

    @Label("Table Size")
    public int tableSize;
  }

  @Name("org.chagres.Attach")
  @Label("Thread Attach")
  @Category(CATEGORY)
  @Description("Host thread attached to or detached from a runtime")
  @StackTrace(false)
  public static class AttachEvent extends Event {
    @Label("Runtime ID")
    public long runtimeId;

    @Label("Thread")
    public String threadName;

    @Label("Operation")
    public String operation; // "attach" or "detach"

    @Label("Detach On Exit")
    public boolean detachOnExit;
  }

  /** Delivery of one managed object through the callback entry point. */
  @Name("org.chagres.Callback")
  @Label("Callback")
  @Category(CATEGORY)
  @Description("Managed-runtime callback delivered to a host channel")
  @StackTrace(false)
  public static class CallbackEvent extends Event {
    @Label("Channel Token")
    public long channelToken;

    @Label("Value Type")
    public String valueType;

    @Label("Success")
    public boolean success;

    @Label("Error Message")
    public String errorMessage;
  }

  // --- Static helper methods for easy event emission ---

  public static InvocationEvent beginInvocation(InvocationContext ctx) {
    InvocationEvent event = new InvocationEvent();
    event.runtimeId = ctx.runtimeId();
    event.invocationId = ctx.invocationId();
    event.operation = ctx.operationName();
    event.target = ctx.target();
    event.begin();
    return event;
  }

  public static void endInvocation(InvocationEvent event, boolean success, String errorKind) {
    event.success = success;
    event.errorKind = errorKind;
    event.end();
    event.commit();
  }

  public static void emitMethodResolution(
      String className,
      String memberName,
      int candidateCount,
      String chosenMember,
      int phase,
      String argumentTypes) {
    MethodResolutionEvent event = new MethodResolutionEvent();
    if (!event.isEnabled()) return;
    event.className = className;
    event.memberName = memberName;
    event.candidateCount = candidateCount;
    event.chosenMember = chosenMember;
    event.phase = phase;
    event.argumentTypes = argumentTypes;
    event.commit();
  }

  public static void emitReference(
      long runtimeId, long token, String operation, String objectType, int tableSize) {
    ReferenceEvent event = new ReferenceEvent();
    if (!event.isEnabled()) return;
    event.runtimeId = runtimeId;
    event.token = token;
    event.operation = operation;
    event.objectType = objectType;
    event.tableSize = tableSize;
    event.commit();
  }

  public static void emitAttach(
      long runtimeId, String threadName, String operation, boolean detachOnExit) {
    AttachEvent event = new AttachEvent();
    event.runtimeId = runtimeId;
    event.threadName = threadName;
    event.operation = operation;
    event.detachOnExit = detachOnExit;
    event.commit();
  }

  public static CallbackEvent beginCallback(long channelToken, String valueType) {
    CallbackEvent event = new CallbackEvent();
    event.channelToken = channelToken;
    event.valueType = valueType;
    event.begin();
    return event;
  }

  public static void endCallback(CallbackEvent event, boolean success, String errorMessage) {
    event.success = success;
    event.errorMessage = errorMessage;
    event.end();
    event.commit();
  }
}
