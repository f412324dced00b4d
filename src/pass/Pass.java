package pass;


public interface Pass {
    // just a mark class, passes of other kinds may follow

    /**
     * A step of the unroller pipeline. Passes read and fill the {@link PassContext} of
     * the run; none of them keeps state of its own between runs.
     */
    public interface GraphPass extends Pass {
        GraphPassType getType();
        void run(PassContext context);
    }
}
