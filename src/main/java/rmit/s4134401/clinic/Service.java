package rmit.s4134401.clinic;

import java.math.BigDecimal;
import java.util.Objects;

public class Service {
    private final String name;
    private final BigDecimal price;

    public Service(String name, BigDecimal price){
        if (name == null || price == null) throw new IllegalArgumentException("null service");
        if (price.signum() < 0) throw new IllegalArgumentException("price must be >= 0: " + price);
        this.name = name;
        this.price = price;
    }

    public Service(String name, long price){ this(name, BigDecimal.valueOf(price)); }

    public String name(){ return name; }
    public BigDecimal price(){ return price; }

    // 100 and 100.00 are the same price
    @Override public boolean equals(Object o){
        if (this == o) return true;
        if (!(o instanceof Service)) return false;
        Service s = (Service) o;
        return name.equals(s.name) && price.compareTo(s.price) == 0;
    }

    @Override public int hashCode(){ return Objects.hash(name, price.stripTrailingZeros()); }

    @Override public String toString(){ return name + " " + price.toPlainString(); }
}
