package io.hyperfoil.tools.seqdiag.model;

import java.util.Locale;

/**
 * Shape category of a participant. Declared with "Name is a type" or inferred from the name.
 */
public enum ParticipantType {
    DEFAULT("default"),
    SERVICE("service"),
    DATABASE("database"),
    ACTOR("actor"),
    QUEUE("queue"),
    CACHE("cache"),
    GATEWAY("gateway"),
    EXTERNAL("external"),
    NETWORKING("networking"),
    FRONTEND("frontend");

    private final String name;

    ParticipantType(String name){
        this.name = name;
    }

    public String getName(){return name;}

    /**
     * @return the declarable type for the name or null. <code>default</code> cannot be declared.
     */
    public static ParticipantType fromDeclaration(String name){
        if(name == null){
            return null;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        for(ParticipantType type : values()){
            if(type != DEFAULT && type.name.equals(lower)){
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString(){
        return name;
    }
}
