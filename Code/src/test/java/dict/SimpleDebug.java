package dict;

public class SimpleDebug {
    public static void main(String[] args) {
        OrderedDict<Integer, String> d = new OrderedDict<>();

        for (int k : new int[]{5, 3, 8, 1, 4, 7, 9}) d.add(k, "v" + k);

        System.out.println("Size: " + d.sizeStructural());
        System.out.println("Height: " + d.height());
        System.out.print(d.toTreeString());

        d.remove(5);
        System.out.println("After remove(5):");
        System.out.print(d.toTreeString());
        System.out.println("Valid: " + d.checkInvariants());
    }
}
