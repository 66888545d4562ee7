package io.hyperfoil.tools.seqdiag.model;

import java.util.Locale;

public enum NotePosition {
    LEFT, RIGHT;

    public static NotePosition parse(String value){
        if(value == null || value.isBlank()){
            return RIGHT;
        }
        return "left".equals(value.toLowerCase(Locale.ROOT)) ? LEFT : RIGHT;
    }

    @Override
    public String toString(){
        return name().toLowerCase(Locale.ROOT);
    }
}
