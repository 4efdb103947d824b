package work.lcod.assertkit.constraints;

public enum ConstraintStatus {
    UNKNOWN,
    SUCCESS,
    FAILURE,
    ERROR
}
