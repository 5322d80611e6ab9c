package fol.term;

public enum Sort {
    ELEMENT,
    SET
}
